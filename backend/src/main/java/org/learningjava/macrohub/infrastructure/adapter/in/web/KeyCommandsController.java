package org.learningjava.macrohub.infrastructure.adapter.in.web;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.learningjava.macrohub.application.usecase.GenerateKeyCommandsUseCase;
import org.learningjava.macrohub.application.usecase.MergeKeyCommandsUseCase;
import org.learningjava.macrohub.application.usecase.ParseKeyCommandsUseCase;
import org.learningjava.macrohub.domain.model.keycommands.CategoryNode;
import org.learningjava.macrohub.domain.model.keycommands.GeneratedKeyCommands;
import org.learningjava.macrohub.domain.model.keycommands.MacroRecord;
import org.learningjava.macrohub.domain.model.keycommands.ParseResult;
import org.learningjava.macrohub.domain.model.keycommands.PartialExtractionNotice;
import org.learningjava.macrohub.domain.model.keycommands.SubCommand;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/keycommands")
public class KeyCommandsController {

    private final ParseKeyCommandsUseCase parseUseCase;
    private final GenerateKeyCommandsUseCase generateUseCase;
    private final MergeKeyCommandsUseCase mergeUseCase;

    public KeyCommandsController(ParseKeyCommandsUseCase parseUseCase,
                                 GenerateKeyCommandsUseCase generateUseCase,
                                 MergeKeyCommandsUseCase mergeUseCase) {
        this.parseUseCase = parseUseCase;
        this.generateUseCase = generateUseCase;
        this.mergeUseCase = mergeUseCase;
    }

    // ----------------------------- endpoints -----------------------------

    @PostMapping(value = "/parse", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ParseResponse parse(@RequestParam("file") MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "No file provided");
        }
        String name = file.getOriginalFilename() == null ? "" : file.getOriginalFilename();
        if (!name.toLowerCase().endsWith(".xml")) {
            throw new ResponseStatusException(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "File must be an XML file");
        }
        ParseResult result = parseUseCase.parse(name, bytes(file));
        return ParseResponse.from(result);
    }

    @PostMapping(value = "/generate", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<byte[]> generate(@Valid @RequestBody GenerateRequest req) {
        if (req.records().isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "No macros selected");
        }
        GeneratedKeyCommands out = generateUseCase.generate(toRecords(req.records()), req.order(), req.baseName());
        return download(out);
    }

    @PostMapping(value = "/merge", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<byte[]> merge(@Valid @RequestBody MergeRequest req) {
        GeneratedKeyCommands out = mergeUseCase.merge(req.userXml(), toRecords(req.records()), req.baseName());
        return download(out);
    }

    // ----------------------------- helpers -----------------------------

    private static byte[] bytes(MultipartFile file) {
        try {
            return file.getBytes();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read upload " + file.getOriginalFilename(), e);
        }
    }

    private static List<MacroRecord> toRecords(List<MacroDTO> dtos) {
        try {
            return dtos.stream().map(MacroDTO::toRecord).toList();
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid macro: " + e.getMessage(), e);
        }
    }

    private static ResponseEntity<byte[]> download(GeneratedKeyCommands out) {
        ContentDisposition disposition = ContentDisposition.attachment()
                .filename(out.fileName(), StandardCharsets.UTF_8)
                .build();
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
                .contentType(MediaType.APPLICATION_XML)
                .body(out.xml().getBytes(StandardCharsets.UTF_8));
    }

    // ----------------------------- DTOs -----------------------------

    public record GenerateRequest(@NotNull @Valid List<MacroDTO> records, List<String> order, String baseName) {
    }

    public record MergeRequest(@NotBlank String userXml, @NotNull @Valid List<MacroDTO> records, String baseName) {
    }

    public record CommandDTO(@NotBlank String name, Map<String, String> parameters) {
        static CommandDTO from(SubCommand c) {
            return new CommandDTO(c.name(), c.parameters());
        }

        SubCommand toCommand() {
            return new SubCommand(name, parameters == null ? Map.of() : parameters);
        }
    }

    public record MacroDTO(
            @NotBlank String name,
            String description,
            @Valid List<CommandDTO> commands,
            String keyBinding,
            String rawDefinitionSnippet,
            String rawReferenceSnippet
    ) {
        static MacroDTO from(MacroRecord r) {
            return new MacroDTO(
                    r.name(),
                    r.description(),
                    r.commands().stream().map(CommandDTO::from).toList(),
                    r.keyBindingDisplay(),
                    r.rawDefinitionSnippet(),
                    r.rawReferenceSnippet()
            );
        }

        MacroRecord toRecord() {
            List<SubCommand> subCommands = commands == null
                    ? List.of()
                    : commands.stream().map(CommandDTO::toCommand).toList();
            return new MacroRecord(
                    name,
                    description,
                    subCommands,
                    MacroRecord.splitKeyBindings(keyBinding),
                    rawDefinitionSnippet,
                    rawReferenceSnippet
            );
        }
    }

    public record CategoryDTO(String name, List<String> commandNames, boolean macroCategory) {
        static CategoryDTO from(CategoryNode c) {
            return new CategoryDTO(c.name(), c.commandNames(), c.isMacroCategory());
        }
    }

    public record ParseResponse(
            String message,
            int macroCount,
            int skippedCount,
            String notice,
            List<MacroDTO> macros,
            List<CategoryDTO> categories
    ) {
        static ParseResponse from(ParseResult r) {
            return new ParseResponse(
                    ParseKeyCommandsUseCase.summaryMessage(r),
                    r.records().size(),
                    r.skippedCount(),
                    r.notice().map(PartialExtractionNotice::message).orElse(null),
                    r.records().stream().map(MacroDTO::from).toList(),
                    r.categories().stream().map(CategoryDTO::from).toList()
            );
        }
    }
}
