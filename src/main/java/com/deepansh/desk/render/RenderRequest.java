package com.deepansh.desk.render;

import com.deepansh.desk.context.ContextBag;

import java.util.Map;

/**
 * An approved action ready for rendering. The applicant comes from the
 * context bag, never from the parameters the model helped assemble.
 */
public record RenderRequest(String actionName, Map<String, Object> parameters, ContextBag context) {
}
