package com.deepansh.desk.support;

import com.deepansh.desk.render.DocumentRenderer;
import com.deepansh.desk.render.RenderRequest;
import com.deepansh.desk.render.RenderResult;

import java.util.ArrayList;
import java.util.List;

public class CapturingRenderer implements DocumentRenderer {

    private final List<RenderRequest> requests = new ArrayList<>();
    private RenderResult result = RenderResult.success("/tmp/report.pdf");

    public CapturingRenderer failing(String message) {
        this.result = RenderResult.failure(message);
        return this;
    }

    public CapturingRenderer succeeding(String location) {
        this.result = RenderResult.success(location);
        return this;
    }

    @Override
    public RenderResult render(RenderRequest request) {
        requests.add(request);
        return result;
    }

    public List<RenderRequest> requests() {
        return requests;
    }
}
