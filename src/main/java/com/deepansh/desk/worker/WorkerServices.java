package com.deepansh.desk.worker;

import com.deepansh.desk.config.DeskProperties;
import com.deepansh.desk.llm.LlmClient;
import com.deepansh.desk.render.DocumentRenderer;
import com.deepansh.desk.validation.FareTable;
import com.deepansh.desk.validation.FieldValidator;

import java.time.Clock;

/**
 * Stateless collaborators shared by every Worker of every session.
 */
public record WorkerServices(LlmClient llmClient,
                             FieldValidator validator,
                             DocumentRenderer renderer,
                             FareTable fareTable,
                             DeskProperties properties,
                             Clock clock) {
}
