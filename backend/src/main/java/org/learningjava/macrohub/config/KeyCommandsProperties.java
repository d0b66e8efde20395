package org.learningjava.macrohub.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "keycommands")
public class KeyCommandsProperties {
    private long maxInputBytes = 10L * 1024 * 1024;
    private boolean indentOutput = true;
    private int indentAmount = 3;
    private boolean traceEnabled = true;
    private String downloadBaseName = "Key Commands";

    public long getMaxInputBytes() { return maxInputBytes; }
    public void setMaxInputBytes(long v) { this.maxInputBytes = v; }
    public boolean isIndentOutput() { return indentOutput; }
    public void setIndentOutput(boolean v) { this.indentOutput = v; }
    public int getIndentAmount() { return indentAmount; }
    public void setIndentAmount(int v) { this.indentAmount = v; }
    public boolean isTraceEnabled() { return traceEnabled; }
    public void setTraceEnabled(boolean v) { this.traceEnabled = v; }
    public String getDownloadBaseName() { return downloadBaseName; }
    public void setDownloadBaseName(String v) { this.downloadBaseName = v; }
}
