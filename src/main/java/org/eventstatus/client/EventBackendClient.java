package org.eventstatus.client;

import org.eventstatus.client.dto.Event;

import java.util.List;

/**
 * Outbound operations against the events backend.
 * <p>
 * Implementations never throw: transport, protocol and parsing failures are
 * logged and collapsed into {@code false} or an empty list. A caller cannot
 * tell "nothing to do" from "the call failed"; the next tick retries anyway.
 */
public interface EventBackendClient {

    /** Scheduled events whose start date has passed. */
    List<Event> fetchDueToStart();

    /** In-progress events whose end date has passed. */
    List<Event> fetchDueToFinish();

    /** Scheduled events the backend considers expired. */
    List<Event> fetchExpired();

    /** Requests scheduled -> in_progress. True only on an explicit success. */
    boolean start(long eventId);

    /** Requests in_progress -> completed. True only on an explicit success. */
    boolean finish(long eventId);

    /**
     * Kicks off the downstream completion pipeline for a finished event.
     * True when the backend acknowledged the request, regardless of per-participant failures.
     */
    boolean triggerCompletionProcessing(long eventId);

    /** Privileged delete. A 2xx without an explicit {@code success: false} counts as success. */
    boolean delete(long eventId);

    /**
     * Makes sure a superadmin token is held: refresh when one exists, log in otherwise
     * or when the refresh does not produce a token.
     *
     * @return false only when login itself fails
     */
    boolean ensureToken();
}
