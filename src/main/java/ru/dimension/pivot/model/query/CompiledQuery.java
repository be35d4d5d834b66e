package ru.dimension.pivot.model.query;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Parameterized query text plus its bound values in placeholder order
 */
@Value
@Builder
public class CompiledQuery {

  String dataSourceId;
  String sql;
  List<Object> params;
}
