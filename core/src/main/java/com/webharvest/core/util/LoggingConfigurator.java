package com.webharvest.core.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * java.util.logging 루트 설정. SLF4J(slf4j-jdk14)와 StructuredLog 모두 여기로 모인다.
 * - 콘솔 + 사이즈 롤링 파일(logDir/crawler-%g.log)
 */
public final class LoggingConfigurator {
    private LoggingConfigurator() {}

    static final String FILE_PATTERN = "crawler-%g.log";

    /** 한 줄 포맷: "2024-01-01T00:00:00Z INFO  [logger] message" */
    static final Formatter LINE = new Formatter() {
        @Override public String format(LogRecord r) {
            StringBuilder sb = new StringBuilder(128)
                    .append(Instant.ofEpochMilli(r.getMillis())).append(' ')
                    .append(String.format("%-7s", r.getLevel().getName()))
                    .append(" [").append(shortName(r.getLoggerName())).append("] ")
                    .append(formatMessage(r))
                    .append(System.lineSeparator());
            if (r.getThrown() != null) {
                sb.append("  ").append(r.getThrown()).append(System.lineSeparator());
            }
            return sb.toString();
        }
    };

    /**
     * @return 파일 핸들러 설치 여부(디렉터리 생성/파일 열기 실패 시 콘솔만 남기고 false)
     */
    public static boolean init(Path logDir, Level rootLevel, int maxBytes, int fileCount) {
        Logger root = LogManager.getLogManager().getLogger("");
        for (Handler h : root.getHandlers()) root.removeHandler(h);

        ConsoleHandler console = new ConsoleHandler();
        console.setLevel(rootLevel);
        console.setFormatter(LINE);
        root.addHandler(console);
        root.setLevel(rootLevel);

        try {
            Files.createDirectories(logDir);
            String pattern = logDir.resolve(FILE_PATTERN).toString();
            FileHandler file = new FileHandler(pattern, maxBytes, fileCount, true);
            file.setLevel(rootLevel);
            file.setFormatter(LINE);
            root.addHandler(file);
            return true;
        } catch (IOException e) {
            root.log(Level.WARNING, "Failed to init file handler: " + e.getMessage());
            return false;
        }
    }

    private static String shortName(String name) {
        if (name == null) return "";
        int i = name.lastIndexOf('.');
        return i >= 0 ? name.substring(i + 1) : name;
    }
}
