package com.deepansh.desk.render;

public record RenderResult(boolean success, String artifactLocation, String errorMessage) {

    public static RenderResult success(String artifactLocation) {
        return new RenderResult(true, artifactLocation, null);
    }

    public static RenderResult failure(String errorMessage) {
        return new RenderResult(false, null, errorMessage);
    }
}
