package org.learningjava.macrohub.domain.service.keycommands;

public enum PipelineStage {
    LOAD,
    EXTRACT,
    RESOLVE,
    GENERATE,
    MERGE
}
