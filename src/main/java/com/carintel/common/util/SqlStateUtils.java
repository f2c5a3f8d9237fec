package com.carintel.common.util;

import java.sql.SQLException;

/**
 * PostgreSQL SQLState 판별 유틸리티
 */
public class SqlStateUtils {

    /**
     * undefined_table
     */
    public static final String UNDEFINED_TABLE = "42P01";

    private SqlStateUtils() {
    }

    /**
     * 원인 체인에 "relation does not exist" 오류가 있는지 확인
     */
    public static boolean isMissingRelation(Throwable throwable) {
        Throwable current = throwable;
        while (current != null) {
            if (current instanceof SQLException
                    && UNDEFINED_TABLE.equals(((SQLException) current).getSQLState())) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }
}
