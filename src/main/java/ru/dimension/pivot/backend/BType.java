package ru.dimension.pivot.backend;

public enum BType {
  H2,
  POSTGRES,
  MYSQL,
  CLICKHOUSE,
  ORACLE,
  MSSQL
}
