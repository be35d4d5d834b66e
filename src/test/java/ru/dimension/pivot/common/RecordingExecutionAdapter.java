package ru.dimension.pivot.common;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import lombok.Getter;
import ru.dimension.pivot.model.query.CompiledQuery;
import ru.dimension.pivot.model.query.Row;
import ru.dimension.pivot.storage.ExecutionAdapter;

/**
 * Records every executed query and answers with a scripted future
 */
public class RecordingExecutionAdapter implements ExecutionAdapter {

  @Getter
  private final List<CompiledQuery> executed = new ArrayList<>();

  @Getter
  private CompletableFuture<List<Row>> lastFuture;

  private final Function<CompiledQuery, CompletableFuture<List<Row>>> answer;

  public RecordingExecutionAdapter(Function<CompiledQuery, CompletableFuture<List<Row>>> answer) {
    this.answer = answer;
  }

  public static RecordingExecutionAdapter returning(List<Row> rows) {
    return new RecordingExecutionAdapter(query -> CompletableFuture.completedFuture(rows));
  }

  public static RecordingExecutionAdapter pending() {
    return new RecordingExecutionAdapter(query -> new CompletableFuture<>());
  }

  @Override
  public synchronized CompletableFuture<List<Row>> execute(CompiledQuery query) {
    executed.add(query);
    lastFuture = answer.apply(query);
    return lastFuture;
  }

  public boolean wasInvoked() {
    return !executed.isEmpty();
  }
}
