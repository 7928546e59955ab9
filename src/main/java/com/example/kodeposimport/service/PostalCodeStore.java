package com.example.kodeposimport.service;

import com.example.kodeposimport.config.AppProperties;
import com.example.kodeposimport.dto.PostalCode;
import com.example.kodeposimport.exception.StoreUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.sql.*;
import java.util.*;

/**
 * postal_codes 的读写 (原生 JDBC, 走应用的 Hikari 连接池)
 * 所有语句都带超时；约束冲突以外的 SQLException 统一转成 StoreUnavailableException
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PostalCodeStore {

    public static final String TIMEOUT_MESSAGE = "Store operation timed out";
    public static final String UNAVAILABLE_MESSAGE = "Store unavailable";
    public static final String CONSTRAINT_MESSAGE = "Record rejected by a store constraint";

    private static final int MYSQL_DUPLICATE_KEY = 1062;
    private static final String UNIQUE_VIOLATION_STATE = "23505";

    private final DataSource dataSource;
    private final JdbcHelper jdbcHelper;
    private final AppProperties config;

    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    /**
     * @return codes 中已经存在于库里的部分
     */
    public Set<Integer> findExistingCodes(Collection<Integer> codes) {
        if (codes.isEmpty()) {
            return Collections.emptySet();
        }
        List<Integer> codeList = new ArrayList<>(codes);
        String sql = jdbcHelper.existingCodesSql(codeList.size());
        Set<Integer> existing = new HashSet<>();
        try (Connection conn = getConnection();
             PreparedStatement ps = prepare(conn, sql)) {
            for (int i = 0; i < codeList.size(); i++) {
                ps.setInt(i + 1, codeList.get(i));
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    existing.add(rs.getInt(1));
                }
            }
        } catch (SQLException e) {
            log.error("failed to execute {}", sql);
            throw unavailable(e);
        }
        return existing;
    }

    public void insert(Connection conn, PostalCode postalCode) throws SQLException {
        String sql = jdbcHelper.insertSql();
        try (PreparedStatement ps = prepare(conn, sql)) {
            ps.setInt(1, postalCode.getCode());
            bindFields(ps, postalCode, 2);
            ps.executeUpdate();
        }
    }

    /**
     * @return 受影响行数, 0 表示记录不存在
     */
    public int update(Connection conn, PostalCode postalCode) throws SQLException {
        String sql = jdbcHelper.updateSql();
        try (PreparedStatement ps = prepare(conn, sql)) {
            int next = bindFields(ps, postalCode, 1);
            ps.setInt(next, postalCode.getCode());
            return ps.executeUpdate();
        }
    }

    /**
     * 唯一键冲突: MySQL 错误码 1062, H2 为 SQLState 23505
     * 只有这一种冲突按重复策略重新归类
     */
    public boolean isUniqueViolation(SQLException e) {
        if (e instanceof SQLIntegrityConstraintViolationException && e.getErrorCode() == MYSQL_DUPLICATE_KEY) {
            return true;
        }
        return UNIQUE_VIOLATION_STATE.equals(e.getSQLState());
    }

    /**
     * 其他完整性约束 (NOT NULL / CHECK, SQLState 23xxx) 属于记录级错误
     */
    public boolean isIntegrityViolation(SQLException e) {
        if (e instanceof SQLIntegrityConstraintViolationException) {
            return true;
        }
        String state = e.getSQLState();
        return state != null && state.startsWith("23");
    }

    public StoreUnavailableException unavailable(SQLException e) {
        if (e instanceof SQLTimeoutException) {
            return new StoreUnavailableException(TIMEOUT_MESSAGE, e);
        }
        return new StoreUnavailableException(UNAVAILABLE_MESSAGE, e);
    }

    private PreparedStatement prepare(Connection conn, String sql) throws SQLException {
        PreparedStatement ps = conn.prepareStatement(sql);
        int timeout = config.getStore().getQueryTimeoutSeconds();
        if (timeout > 0) {
            ps.setQueryTimeout(timeout);
        }
        return ps;
    }

    // village, district, regency, province, latitude, longitude, elevation, timezone
    private int bindFields(PreparedStatement ps, PostalCode pc, int index) throws SQLException {
        ps.setString(index++, pc.getVillage());
        ps.setString(index++, pc.getDistrict());
        ps.setString(index++, pc.getRegency());
        ps.setString(index++, pc.getProvince());
        setNullableDouble(ps, index++, pc.getLatitude());
        setNullableDouble(ps, index++, pc.getLongitude());
        if (pc.getElevation() == null) {
            ps.setNull(index++, Types.INTEGER);
        } else {
            ps.setInt(index++, pc.getElevation());
        }
        ps.setString(index++, pc.getTimezone());
        return index;
    }

    private void setNullableDouble(PreparedStatement ps, int index, Double value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.DOUBLE);
        } else {
            ps.setDouble(index, value);
        }
    }
}
