package io.statsheets.core;

import java.util.List;
import java.util.concurrent.CompletionStage;

/**
 * Fetches the records for a batch of entity ids with a single request.
 * Records may come back in any order, and nothing pairs them back up with the ids that were asked for.
 */
public interface BatchFetch {
    <T> CompletionStage<List<T>> fetch(Endpoint<T> endpoint, List<String> ids);
}
