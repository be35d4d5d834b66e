package ru.dimension.pivot.model.output;

import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class GeneratedSql {

  String sql;

  /**
   * Bound values rendered as text, for display only
   */
  List<String> params;
}
