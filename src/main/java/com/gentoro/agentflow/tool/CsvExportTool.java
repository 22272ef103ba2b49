package com.gentoro.agentflow.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.agentflow.exception.ToolExecutionException;
import com.gentoro.agentflow.model.ToolDefinition;
import com.gentoro.agentflow.model.ToolProperty;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import javax.sql.DataSource;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

/** Runs a query and writes the result, with a header line, to a CSV file. */
public class CsvExportTool extends AbstractTool {
  private final DataSource dataSource;
  private final Path baseDirectory;

  public CsvExportTool(String name, DataSource dataSource, Path baseDirectory) {
    super(
        ToolDefinition.builder()
            .name(name)
            .description("Export the result of a SQL query to a CSV file.")
            .schema(
                ToolProperty.builder()
                    .name("arguments")
                    .type(ToolProperty.Type.OBJECT)
                    .property(
                        ToolProperty.builder()
                            .name("query")
                            .description("SELECT statement producing the rows")
                            .type(ToolProperty.Type.STRING)
                            .required(true)
                            .build())
                    .property(
                        ToolProperty.builder()
                            .name("file")
                            .description("Output CSV file, relative to the data directory")
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
        ToolKind.BULK_EXPORT);
    this.dataSource = dataSource;
    this.baseDirectory = baseDirectory.toAbsolutePath().normalize();
  }

  @Override
  protected JsonNode execute(JsonNode arguments) {
    Path file = CsvFiles.resolve(baseDirectory, arguments.get("file").asText());
    char delimiter = CsvFiles.delimiter(text(arguments, "delimiter", ","));
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(arguments.get("query").asText());
        ResultSet rs = ps.executeQuery()) {
      List<String> columns = JdbcValues.columnLabels(rs);
      CSVFormat format =
          CSVFormat.DEFAULT
              .builder()
              .setDelimiter(delimiter)
              .setHeader(columns.toArray(String[]::new))
              .build();
      Files.createDirectories(file.getParent());
      int exported = 0;
      try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
          CSVPrinter printer = new CSVPrinter(writer, format)) {
        while (rs.next()) {
          List<Object> row = new ArrayList<>(columns.size());
          for (int c = 1; c <= columns.size(); c++) {
            row.add(rs.getObject(c));
          }
          printer.printRecord(row);
          exported++;
        }
      }
      ObjectNode out = JsonNodeFactory.instance.objectNode();
      out.put("file", baseDirectory.relativize(file).toString());
      out.put("rowsExported", exported);
      return out;
    } catch (SQLException e) {
      throw new ToolExecutionException("SQL error while exporting CSV: " + e.getMessage(), e);
    } catch (IOException e) {
      throw new ToolExecutionException("Failed to write CSV file: " + e.getMessage(), e);
    }
  }
}
