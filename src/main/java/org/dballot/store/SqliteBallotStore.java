package org.dballot.store;

import org.dballot.identity.Identity;
import org.dballot.ledger.VotingRecord;
import org.dballot.proposal.ProposalLabel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * SQLite backed BallotStore.
 * <p>
 * Outside {@link #atomically(Runnable)} every call opens its own auto-committed connection.
 * Inside it, all calls on the same thread share one connection and commit together, or roll
 * back together if the body throws. Uses WAL mode and a busy timeout.
 */
public class SqliteBallotStore implements BallotStore {

    private static final Logger log = LoggerFactory.getLogger(SqliteBallotStore.class);

    private static final String ADMINISTRATOR_KEY = "ADMINISTRATOR";
    private static final String GRANTED_WEIGHT_KEY = "GRANTED_WEIGHT";

    private final String dbUrl;
    private final ThreadLocal<Connection> transaction = new ThreadLocal<>();

    public SqliteBallotStore(String dbFileName) {
        this.dbUrl = "jdbc:sqlite:" + dbFileName;
        initializeDatabase();
    }

    // --- Connection management ---

    private Connection connect() throws SQLException {
        Connection conn = DriverManager.getConnection(dbUrl);
        try (Statement s = conn.createStatement()) {
            s.execute("PRAGMA journal_mode=WAL;");
            s.execute("PRAGMA synchronous=NORMAL;");
            s.execute("PRAGMA busy_timeout=5000;");
        }
        return conn;
    }

    private <T> T withConnection(SQLFunction<T> body) {
        Connection bound = transaction.get();
        try {
            if (bound != null)
                return body.apply(bound);
            try (Connection conn = connect()) {
                return body.apply(conn);
            }
        } catch (SQLException e) {
            throw wrap(e);
        }
    }

    private RuntimeException wrap(SQLException e) {
        log.error("[SqliteBallotStore] " + e.getMessage());
        return new IllegalStateException("Ballot storage failure: " + e.getMessage(), e);
    }

    private void initializeDatabase() {
        String configStoreSql = """
                CREATE TABLE IF NOT EXISTS config_store (
                    key TEXT PRIMARY KEY,
                    value TEXT
                );""";

        String proposalsSql = """
                CREATE TABLE IF NOT EXISTS proposals (
                    idx INTEGER PRIMARY KEY,
                    label BLOB NOT NULL,
                    vote_count INTEGER NOT NULL DEFAULT 0
                );""";

        String votersSql = """
                CREATE TABLE IF NOT EXISTS voters (
                    identity TEXT PRIMARY KEY,
                    weight INTEGER NOT NULL DEFAULT 0,
                    has_voted INTEGER NOT NULL DEFAULT 0,
                    delegate_target TEXT,
                    chosen_proposal INTEGER
                );""";

        try (Connection conn = connect(); Statement stmt = conn.createStatement()) {
            stmt.execute(configStoreSql);
            stmt.execute(proposalsSql);
            stmt.execute(votersSql);
            log.info("[SqliteBallotStore] Database and tables initialized at " + dbUrl);
        } catch (SQLException e) {
            throw wrap(e);
        }
    }

    // --- Config store ---

    private String getConfig(String key) {
        return withConnection(conn -> {
            try (PreparedStatement pstmt = conn.prepareStatement("SELECT value FROM config_store WHERE key = ?")) {
                pstmt.setString(1, key);
                try (ResultSet rs = pstmt.executeQuery()) {
                    return rs.next() ? rs.getString("value") : null;
                }
            }
        });
    }

    private void putConfig(String key, String value) {
        withConnection(conn -> {
            try (PreparedStatement pstmt = conn.prepareStatement(
                    "INSERT OR REPLACE INTO config_store (key, value) VALUES (?, ?)")) {
                pstmt.setString(1, key);
                pstmt.setString(2, value);
                return pstmt.executeUpdate();
            }
        });
    }

    @Override
    public Identity getAdministrator() {
        String value = getConfig(ADMINISTRATOR_KEY);
        return value == null ? null : Identity.of(value);
    }

    @Override
    public void putAdministrator(Identity administrator) {
        putConfig(ADMINISTRATOR_KEY, administrator.value());
    }

    @Override
    public long getGrantedWeight() {
        String value = getConfig(GRANTED_WEIGHT_KEY);
        if (value == null)
            return 0L;
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Corrupt granted weight in store: " + value, e);
        }
    }

    @Override
    public void putGrantedWeight(long weight) {
        putConfig(GRANTED_WEIGHT_KEY, Long.toString(weight));
    }

    // --- Proposals ---

    @Override
    public List<ProposalLabel> getProposalLabels() {
        return withConnection(conn -> {
            List<ProposalLabel> labels = new ArrayList<>();
            try (Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery("SELECT label FROM proposals ORDER BY idx")) {
                while (rs.next())
                    labels.add(ProposalLabel.fromBytes(rs.getBytes("label")));
            }
            return labels;
        });
    }

    @Override
    public void putProposals(List<ProposalLabel> labels) {
        withConnection(conn -> {
            try (Statement stmt = conn.createStatement()) {
                stmt.executeUpdate("DELETE FROM proposals");
            }
            try (PreparedStatement pstmt = conn.prepareStatement(
                    "INSERT INTO proposals (idx, label, vote_count) VALUES (?, ?, 0)")) {
                for (int i = 0; i < labels.size(); i++) {
                    pstmt.setInt(1, i);
                    pstmt.setBytes(2, labels.get(i).toBytes());
                    pstmt.addBatch();
                }
                pstmt.executeBatch();
            }
            return null;
        });
    }

    @Override
    public long getVoteCount(int index) {
        return withConnection(conn -> {
            try (PreparedStatement pstmt = conn.prepareStatement("SELECT vote_count FROM proposals WHERE idx = ?")) {
                pstmt.setInt(1, index);
                try (ResultSet rs = pstmt.executeQuery()) {
                    return rs.next() ? rs.getLong("vote_count") : 0L;
                }
            }
        });
    }

    @Override
    public void putVoteCount(int index, long count) {
        withConnection(conn -> {
            try (PreparedStatement pstmt = conn.prepareStatement("UPDATE proposals SET vote_count = ? WHERE idx = ?")) {
                pstmt.setLong(1, count);
                pstmt.setInt(2, index);
                return pstmt.executeUpdate();
            }
        });
    }

    // --- Voters ---

    @Override
    public VotingRecord getRecord(Identity identity) {
        return withConnection(conn -> {
            String sql = "SELECT weight, has_voted, delegate_target, chosen_proposal FROM voters WHERE identity = ?";
            try (PreparedStatement pstmt = conn.prepareStatement(sql)) {
                pstmt.setString(1, identity.value());
                try (ResultSet rs = pstmt.executeQuery()) {
                    if (!rs.next())
                        return null;
                    String delegate = rs.getString("delegate_target");
                    int chosen = rs.getInt("chosen_proposal");
                    Integer chosenProposal = rs.wasNull() ? null : chosen;
                    return new VotingRecord(
                            rs.getLong("weight"),
                            rs.getInt("has_voted") == 1,
                            delegate == null ? null : Identity.of(delegate),
                            chosenProposal);
                }
            }
        });
    }

    @Override
    public void putRecord(Identity identity, VotingRecord record) {
        withConnection(conn -> {
            String sql = """
                    INSERT OR REPLACE INTO voters (identity, weight, has_voted, delegate_target, chosen_proposal)
                    VALUES (?, ?, ?, ?, ?)""";
            try (PreparedStatement pstmt = conn.prepareStatement(sql)) {
                pstmt.setString(1, identity.value());
                pstmt.setLong(2, record.getWeight());
                pstmt.setInt(3, record.hasVoted() ? 1 : 0);
                if (record.getDelegateTarget() == null)
                    pstmt.setNull(4, Types.VARCHAR);
                else
                    pstmt.setString(4, record.getDelegateTarget().value());
                if (record.getChosenProposal() == null)
                    pstmt.setNull(5, Types.INTEGER);
                else
                    pstmt.setInt(5, record.getChosenProposal());
                return pstmt.executeUpdate();
            }
        });
    }

    @Override
    public Set<Identity> getIdentities() {
        return withConnection(conn -> {
            Set<Identity> identities = new HashSet<>();
            try (Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery("SELECT identity FROM voters")) {
                while (rs.next())
                    identities.add(Identity.of(rs.getString("identity")));
            }
            return identities;
        });
    }

    // --- Transactions ---

    @Override
    public void atomically(Runnable body) {
        if (transaction.get() != null) {
            body.run();
            return;
        }

        Connection conn;
        try {
            conn = connect();
            conn.setAutoCommit(false);
        } catch (SQLException e) {
            throw wrap(e);
        }

        transaction.set(conn);
        try {
            body.run();
            conn.commit();
        } catch (SQLException e) {
            rollback(conn);
            throw wrap(e);
        } catch (RuntimeException e) {
            rollback(conn);
            throw e;
        } finally {
            transaction.remove();
            try {
                conn.close();
            } catch (SQLException e) {
                log.warn("[SqliteBallotStore] Failed to close connection: " + e.getMessage());
            }
        }
    }

    private void rollback(Connection conn) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            log.error("[SqliteBallotStore] Rollback failed: " + e.getMessage());
        }
    }

    @FunctionalInterface
    private interface SQLFunction<T> {
        T apply(Connection conn) throws SQLException;
    }
}
