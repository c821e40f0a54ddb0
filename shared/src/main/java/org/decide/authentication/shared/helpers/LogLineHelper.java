package org.decide.authentication.shared.helpers;

import org.apache.logging.log4j.ThreadContext;

public class LogLineHelper {

    public enum LogFieldName {
        USER_ID("userId"),
        OPERATION("operation");

        private final String logFieldName;

        LogFieldName(String fieldName) {
            this.logFieldName = fieldName;
        }

        String getLogFieldName() {
            return logFieldName;
        }
    }

    private LogLineHelper() {}

    public static void attachLogFieldToLogs(LogFieldName logFieldName, String value) {
        ThreadContext.put(logFieldName.getLogFieldName(), value);
    }

    public static void attachUserIdToLogs(long userId) {
        attachLogFieldToLogs(LogFieldName.USER_ID, String.valueOf(userId));
    }

    public static void attachOperationToLogs(String operation) {
        attachLogFieldToLogs(LogFieldName.OPERATION, operation);
    }

    public static void clearLogFields() {
        for (LogFieldName fieldName : LogFieldName.values()) {
            ThreadContext.remove(fieldName.getLogFieldName());
        }
    }
}
