package com.gentoro.agentflow.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.agentflow.exception.ToolExecutionException;
import com.gentoro.agentflow.model.ToolDefinition;
import com.gentoro.agentflow.model.ToolProperty;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import javax.sql.DataSource;

/**
 * Executes one SQL statement. Queries return {@code {columns, rows, rowCount, truncated}}; other
 * statements return {@code {updateCount}}. Positional parameters bind to {@code ?} markers.
 */
public class SqlQueryTool extends AbstractTool {
  private final DataSource dataSource;
  private final int maxRows;

  public SqlQueryTool(String name, DataSource dataSource, int maxRows) {
    super(
        ToolDefinition.builder()
            .name(name)
            .description(
                "Execute a SQL statement against the database and return the resulting rows.")
            .schema(
                ToolProperty.builder()
                    .name("arguments")
                    .type(ToolProperty.Type.OBJECT)
                    .property(
                        ToolProperty.builder()
                            .name("query")
                            .description("SQL statement to execute")
                            .type(ToolProperty.Type.STRING)
                            .required(true)
                            .build())
                    .property(
                        ToolProperty.builder()
                            .name("parameters")
                            .description("Values bound to the ? markers, in order")
                            .type(ToolProperty.Type.ARRAY)
                            .items(
                                ToolProperty.builder()
                                    .name("value")
                                    .type(ToolProperty.Type.STRING)
                                    .build())
                            .build())
                    .build())
            .build(),
        ToolKind.QUERY_EXECUTION);
    this.dataSource = dataSource;
    this.maxRows = maxRows;
  }

  @Override
  protected JsonNode execute(JsonNode arguments) {
    String sql = arguments.get("query").asText();
    JsonNode params = arguments.path("parameters");
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setMaxRows(maxRows + 1);
      for (int i = 0; i < params.size(); i++) {
        ps.setString(i + 1, params.get(i).asText());
      }
      ObjectNode out = JsonNodeFactory.instance.objectNode();
      if (!ps.execute()) {
        out.put("updateCount", ps.getUpdateCount());
        return out;
      }
      try (ResultSet rs = ps.getResultSet()) {
        List<String> columns = JdbcValues.columnLabels(rs);
        ArrayNode cols = out.putArray("columns");
        columns.forEach(cols::add);
        ArrayNode rows = out.putArray("rows");
        boolean truncated = false;
        while (rs.next()) {
          if (rows.size() == maxRows) {
            truncated = true;
            break;
          }
          ObjectNode row = rows.addObject();
          for (int c = 0; c < columns.size(); c++) {
            row.set(columns.get(c), JdbcValues.toJson(rs.getObject(c + 1)));
          }
        }
        out.put("rowCount", rows.size());
        out.put("truncated", truncated);
        return out;
      }
    } catch (SQLException e) {
      throw new ToolExecutionException("SQL error: " + e.getMessage(), e);
    }
  }
}
