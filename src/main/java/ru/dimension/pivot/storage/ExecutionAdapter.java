package ru.dimension.pivot.storage;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import ru.dimension.pivot.model.query.CompiledQuery;
import ru.dimension.pivot.model.query.Row;

/**
 * Runs a compiled query against the backing store.
 * <p>
 * Implementations complete the future exceptionally with
 * {@link ru.dimension.pivot.exception.QueryExecutionException} on failure and
 * release their resources when the returned future is cancelled.
 */
public interface ExecutionAdapter {

  CompletableFuture<List<Row>> execute(CompiledQuery query);
}
