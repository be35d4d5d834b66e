package ru.dimension.pivot.storage.dialect;

import java.sql.PreparedStatement;
import java.sql.SQLException;

public class OracleDialect extends GenericDialect {

  @Override
  public String getLimitClass(Integer limit) {
    return limit != null ? " FETCH FIRST " + limit + " ROWS ONLY" : "";
  }

  @Override
  public void setParameter(PreparedStatement ps, int parameterIndex, Object value) throws SQLException {
    if (value instanceof Boolean b) {
      ps.setInt(parameterIndex, b ? 1 : 0);
    } else {
      super.setParameter(ps, parameterIndex, value);
    }
  }
}
