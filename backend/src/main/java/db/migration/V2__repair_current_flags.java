package db.migration;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import org.flywaydb.core.api.migration.BaseJavaMigration;
import org.flywaydb.core.api.migration.Context;

/**
 * Leaves every host with exactly one current snapshot (its latest submission) and registers
 * hosts whose snapshots were loaded without a {@code scan_hosts} row.
 */
public class V2__repair_current_flags extends BaseJavaMigration {

  @Override
  public void migrate(Context context) throws Exception {
    Connection connection = context.getConnection();
    try (Statement statement = connection.createStatement()) {
      statement.executeUpdate(
          "UPDATE scan_snapshots SET is_current = FALSE WHERE is_current IS NULL");
    }

    for (String host : hostsWithoutSingleCurrent(connection)) {
      try (PreparedStatement clear =
          connection.prepareStatement(
              "UPDATE scan_snapshots SET is_current = FALSE WHERE computer_name = ?")) {
        clear.setString(1, host);
        clear.executeUpdate();
      }
      try (PreparedStatement mark =
          connection.prepareStatement(
              "UPDATE scan_snapshots SET is_current = TRUE "
                  + "WHERE id = (SELECT MAX(id) FROM scan_snapshots WHERE computer_name = ?)")) {
        mark.setString(1, host);
        mark.executeUpdate();
      }
    }

    try (Statement statement = connection.createStatement()) {
      statement.executeUpdate(
          "INSERT INTO scan_hosts (host_name, first_seen_at, last_submitted_at, submission_count) "
              + "SELECT s.computer_name, MIN(s.created_at), MAX(s.created_at), COUNT(*) "
              + "FROM scan_snapshots s "
              + "WHERE NOT EXISTS (SELECT 1 FROM scan_hosts h WHERE h.host_name = s.computer_name) "
              + "GROUP BY s.computer_name");
    }
  }

  private List<String> hostsWithoutSingleCurrent(Connection connection) throws SQLException {
    String sql =
        "SELECT computer_name FROM scan_snapshots "
            + "GROUP BY computer_name "
            + "HAVING SUM(CASE WHEN is_current THEN 1 ELSE 0 END) <> 1";
    List<String> hosts = new ArrayList<>();
    try (PreparedStatement ps = connection.prepareStatement(sql);
        ResultSet rs = ps.executeQuery()) {
      while (rs.next()) {
        hosts.add(rs.getString(1));
      }
    }
    return hosts;
  }
}
