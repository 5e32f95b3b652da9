package com.ciro.codepair.standalone;

public final class JoinPaths {
    public static final String PREFIX = "/ws/";

    private JoinPaths() {}

    /**
     * "/ws/abc123" -> "abc123". Sólo cuenta el primer segmento tras /ws/
     * ("/ws/abc/extra" -> "abc").
     *
     * @return el id, o {@code null} si falta o está vacío
     */
    public static String sessionId(String requestPath) {
        if (requestPath == null || !requestPath.startsWith(PREFIX)) return null;
        String rest = requestPath.substring(PREFIX.length());
        int slash = rest.indexOf('/');
        String id = (slash < 0) ? rest : rest.substring(0, slash);
        return id.isBlank() ? null : id;
    }
}
