package com.example.fieldkb.router.handler;

import com.example.fieldkb.router.model.Coverage;
import com.example.fieldkb.router.model.HandlerResult;
import com.example.fieldkb.router.model.QueryRequest;

/**
 * Produces the answer for a routed request. Implementations may block; the dispatcher runs them
 * off the request thread and bounds them with a timeout.
 */
public interface SpecialistHandler {

  HandlerResult handle(QueryRequest request, Coverage coverage);
}
