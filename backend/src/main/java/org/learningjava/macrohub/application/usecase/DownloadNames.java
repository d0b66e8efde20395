package org.learningjava.macrohub.application.usecase;

final class DownloadNames {

    private DownloadNames() {
    }

    // keeps the name usable in a Content-Disposition header on every OS
    static String fileName(String requested, String fallback, String suffix) {
        String base = requested == null || requested.isBlank() ? fallback : requested.strip();
        if (base.toLowerCase().endsWith(".xml")) {
            base = base.substring(0, base.length() - 4);
        }
        base = base.replaceAll("[\\\\/:*?\"<>|\\r\\n]", "_");
        return base + suffix;
    }
}
