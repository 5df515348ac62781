package com.deepansh.desk.render;

/**
 * Produces the document artifact for an approved action. Invoked only after
 * an approve decision. Implementations report failure through the result
 * instead of throwing so the caller can offer a retry.
 */
public interface DocumentRenderer {

    RenderResult render(RenderRequest request);
}
