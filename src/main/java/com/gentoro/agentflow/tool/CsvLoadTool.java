package com.gentoro.agentflow.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.agentflow.exception.ToolExecutionException;
import com.gentoro.agentflow.model.ToolDefinition;
import com.gentoro.agentflow.model.ToolProperty;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;
import java.util.stream.Collectors;
import javax.sql.DataSource;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

/**
 * Bulk-loads a CSV file (first line is the header) into an existing table. Columns are matched by
 * header name and all rows are inserted in one transaction.
 */
public class CsvLoadTool extends AbstractTool {
  private static final int BATCH = 500;

  private final DataSource dataSource;
  private final Path baseDirectory;

  public CsvLoadTool(String name, DataSource dataSource, Path baseDirectory) {
    super(
        ToolDefinition.builder()
            .name(name)
            .description("Load rows from a CSV file with a header line into a database table.")
            .schema(
                ToolProperty.builder()
                    .name("arguments")
                    .type(ToolProperty.Type.OBJECT)
                    .property(
                        ToolProperty.builder()
                            .name("file")
                            .description("CSV file, relative to the data directory")
                            .type(ToolProperty.Type.STRING)
                            .required(true)
                            .build())
                    .property(
                        ToolProperty.builder()
                            .name("table")
                            .description("Target table")
                            .type(ToolProperty.Type.STRING)
                            .required(true)
                            .build())
                    .property(
                        ToolProperty.builder()
                            .name("delimiter")
                            .description("Single character field delimiter, ',' by default")
                            .type(ToolProperty.Type.STRING)
                            .build())
                    .build())
            .build(),
        ToolKind.BULK_LOAD);
    this.dataSource = dataSource;
    this.baseDirectory = baseDirectory.toAbsolutePath().normalize();
  }

  @Override
  protected JsonNode execute(JsonNode arguments) {
    Path file = CsvFiles.resolve(baseDirectory, arguments.get("file").asText());
    String table = JdbcValues.identifier(arguments.get("table").asText());
    CSVFormat format =
        CSVFormat.DEFAULT
            .builder()
            .setDelimiter(CsvFiles.delimiter(text(arguments, "delimiter", ",")))
            .setHeader()
            .setSkipHeaderRecord(true)
            .setTrim(true)
            .build();
    if (!Files.isRegularFile(file)) {
      throw new ToolExecutionException("CSV file not found: " + baseDirectory.relativize(file));
    }

    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
        CSVParser parser = format.parse(reader);
        Connection conn = dataSource.getConnection()) {
      List<String> columns = parser.getHeaderNames();
      if (columns.isEmpty()) {
        throw new ToolExecutionException("CSV file has no header line");
      }
      columns.forEach(JdbcValues::identifier);
      String sql =
          "INSERT INTO %s (%s) VALUES (%s)"
              .formatted(
                  table,
                  String.join(", ", columns),
                  columns.stream().map(c -> "?").collect(Collectors.joining(", ")));

      boolean autoCommit = conn.getAutoCommit();
      conn.setAutoCommit(false);
      int loaded = 0;
      try (PreparedStatement ps = conn.prepareStatement(sql)) {
        for (CSVRecord record : parser) {
          if (record.size() != columns.size()) {
            throw new ToolExecutionException(
                "Line %d has %d fields, expected %d"
                    .formatted(record.getRecordNumber() + 1, record.size(), columns.size()));
          }
          for (int i = 0; i < columns.size(); i++) {
            String v = record.get(i);
            ps.setString(i + 1, v.isEmpty() ? null : v);
          }
          ps.addBatch();
          if (++loaded % BATCH == 0) ps.executeBatch();
        }
        ps.executeBatch();
        conn.commit();
      } catch (SQLException | RuntimeException e) {
        conn.rollback();
        throw e;
      } finally {
        conn.setAutoCommit(autoCommit);
      }

      ObjectNode out = JsonNodeFactory.instance.objectNode();
      out.put("table", table);
      out.put("rowsLoaded", loaded);
      return out;
    } catch (SQLException e) {
      throw new ToolExecutionException("SQL error while loading CSV: " + e.getMessage(), e);
    } catch (IOException | java.io.UncheckedIOException e) {
      throw new ToolExecutionException("Failed to read CSV file: " + e.getMessage(), e);
    }
  }
}
