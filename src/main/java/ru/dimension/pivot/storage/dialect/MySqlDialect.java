package ru.dimension.pivot.storage.dialect;

public class MySqlDialect extends GenericDialect {

  @Override
  public String quoteAlias(String alias) {
    return "`" + alias.replace("`", "") + "`";
  }
}
