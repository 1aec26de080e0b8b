package com.mobilebackup.importer.parser;

import com.mobilebackup.importer.exception.RecordDecodeException;
import com.mobilebackup.importer.model.RecordCategory;
import com.mobilebackup.importer.sync.CancellationToken;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * 把一个查询的 ResultSet 包成惰性 Stream：
 * - 每行之前检查取消信号
 * - 单行解码失败记到 decodeErrors 并跳过，不中断整个提取
 * - 游标本身出错（库损坏）则提前结束并记警告
 * - 流关闭时依次关闭 ResultSet / Statement / Connection
 */
@Slf4j
final class SqliteRowStream {

    @FunctionalInterface
    interface RowDecoder<T> {
        T decode(ResultSet rs) throws SQLException;
    }

    private SqliteRowStream() {
    }

    static <T> Extraction<T> open(RecordCategory category,
                                  Connection conn,
                                  String sql,
                                  RowDecoder<T> decoder,
                                  CancellationToken token) throws SQLException {
        PreparedStatement ps = conn.prepareStatement(sql);
        ResultSet rs;
        try {
            rs = ps.executeQuery();
        } catch (SQLException e) {
            ps.close();
            throw e;
        }

        AtomicReference<Extraction<T>> holder = new AtomicReference<>();

        Spliterator<T> spliterator = new Spliterators.AbstractSpliterator<>(Long.MAX_VALUE,
                Spliterator.ORDERED | Spliterator.NONNULL) {
            private boolean exhausted;

            @Override
            public boolean tryAdvance(Consumer<? super T> action) {
                while (!exhausted) {
                    if (token.isCancelled()) {
                        log.info("{} 提取已取消", category.key());
                        holder.get().markCancelled();
                        exhausted = true;
                        return false;
                    }
                    try {
                        if (!rs.next()) {
                            exhausted = true;
                            return false;
                        }
                    } catch (SQLException e) {
                        log.warn("{} 游标读取失败，提前结束: {}", category.key(), e.getMessage());
                        holder.get().getWarnings().add(String.format(
                                "SourceUnreadable: %s cursor failed: %s", category.key(), e.getMessage()));
                        exhausted = true;
                        return false;
                    }
                    try {
                        T record = decoder.decode(rs);
                        if (record != null) {
                            action.accept(record);
                            return true;
                        }
                    } catch (SQLException | RuntimeException e) {
                        RecordDecodeException err = new RecordDecodeException(category, rowRef(rs), e);
                        log.warn(err.getMessage());
                        holder.get().getDecodeErrors().add(err.getMessage());
                    }
                }
                return false;
            }
        };

        Stream<T> stream = StreamSupport.stream(spliterator, false).onClose(() -> {
            try {
                rs.close();
                ps.close();
                conn.close();
                log.debug("{} 内嵌库已关闭", category.key());
            } catch (SQLException e) {
                log.warn("关闭 {} 内嵌库失败: {}", category.key(), e.getMessage());
            }
        });

        Extraction<T> extraction = new Extraction<>(category, stream, true);
        holder.set(extraction);
        return extraction;
    }

    /** 第一列约定为源库 rowid，报错时带上方便排查 */
    private static String rowRef(ResultSet rs) {
        try {
            return String.valueOf(rs.getObject(1));
        } catch (SQLException e) {
            return "?";
        }
    }
}
