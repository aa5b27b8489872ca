package com.flowpulse.infrastructure.typehandler;

import org.apache.ibatis.type.BaseTypeHandler;
import org.apache.ibatis.type.JdbcType;
import org.apache.ibatis.type.MappedTypes;

import java.sql.CallableStatement;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;

/**
 * 工作流状态与 webhook 表的 TIMESTAMPTZ 列按应用时钟所在时区映射为 LocalDateTime。
 * 聚合查询（MIN/MAX::text）返回的字符串同样在这里解析。
 */
@MappedTypes(LocalDateTime.class)
public class CompatibleLocalDateTimeTypeHandler extends BaseTypeHandler<LocalDateTime> {

    private final ZoneId zone;

    public CompatibleLocalDateTimeTypeHandler() {
        this(ZoneId.systemDefault());
    }

    CompatibleLocalDateTimeTypeHandler(ZoneId zone) {
        this.zone = zone;
    }

    @Override
    public void setNonNullParameter(PreparedStatement ps, int i, LocalDateTime parameter, JdbcType jdbcType) throws SQLException {
        ps.setObject(i, parameter.atZone(zone).toOffsetDateTime());
    }

    @Override
    public LocalDateTime getNullableResult(ResultSet rs, String columnName) throws SQLException {
        return toLocal(rs.getObject(columnName), columnName);
    }

    @Override
    public LocalDateTime getNullableResult(ResultSet rs, int columnIndex) throws SQLException {
        return toLocal(rs.getObject(columnIndex), "#" + columnIndex);
    }

    @Override
    public LocalDateTime getNullableResult(CallableStatement cs, int columnIndex) throws SQLException {
        return toLocal(cs.getObject(columnIndex), "#" + columnIndex);
    }

    LocalDateTime toLocal(Object raw, String column) throws SQLException {
        if (raw == null || raw instanceof LocalDateTime) {
            return (LocalDateTime) raw;
        }
        Instant instant;
        if (raw instanceof OffsetDateTime odt) {
            instant = odt.toInstant();
        } else if (raw instanceof Timestamp ts) {
            return ts.toLocalDateTime();
        } else if (raw instanceof Instant value) {
            instant = value;
        } else if (raw instanceof String text) {
            instant = parseText(text.trim(), column);
        } else {
            throw new SQLException("Column " + column + " holds unsupported time value: " + raw.getClass().getName());
        }
        return LocalDateTime.ofInstant(instant, zone);
    }

    private Instant parseText(String text, String column) throws SQLException {
        // PostgreSQL ::text 输出形如 "2026-10-01 12:00:00.123+00"
        String iso = text.replace(' ', 'T');
        if (iso.matches(".*[+-]\\d{2}$")) {
            iso = iso + ":00";
        }
        try {
            return OffsetDateTime.parse(iso).toInstant();
        } catch (DateTimeParseException ex) {
            throw new SQLException("Column " + column + " holds unparsable time text: " + text, ex);
        }
    }
}
