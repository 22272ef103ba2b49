package com.gentoro.agentflow.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/** JDBC helpers shared by the SQL and CSV tools. */
final class JdbcValues {
  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  private JdbcValues() {}

  static List<String> columnLabels(ResultSet rs) throws SQLException {
    ResultSetMetaData md = rs.getMetaData();
    List<String> labels = new ArrayList<>(md.getColumnCount());
    for (int i = 1; i <= md.getColumnCount(); i++) {
      labels.add(md.getColumnLabel(i));
    }
    return labels;
  }

  static JsonNode toJson(Object value) {
    JsonNodeFactory f = JsonNodeFactory.instance;
    if (value == null) return f.nullNode();
    if (value instanceof Boolean b) return f.booleanNode(b);
    if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return f.numberNode(((Number) value).intValue());
    }
    if (value instanceof Long l) return f.numberNode(l);
    if (value instanceof BigInteger bi) return f.numberNode(bi);
    if (value instanceof BigDecimal bd) return f.numberNode(bd);
    if (value instanceof Number n) return f.numberNode(n.doubleValue());
    return f.textNode(value.toString());
  }

  /** Table and column names are interpolated into SQL, so only plain identifiers pass. */
  static String identifier(String name) {
    if (name == null || !IDENTIFIER.matcher(name).matches()) {
      throw new com.gentoro.agentflow.exception.ToolExecutionException(
          "Not a valid SQL identifier: " + name);
    }
    return name;
  }
}
