package com.questrail.bridge.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Server-side filter applied to captured log lines. Every present criterion
 * must match; absent criteria match everything.
 *
 * @param levels levels to keep; empty keeps all
 * @param tag    exact tag to keep
 * @param text   substring the message must contain
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LogFilter(
        @JsonProperty("level") List<LogLevel> levels,
        String tag,
        String text
) {
    public LogFilter {
        levels = levels == null ? List.of() : List.copyOf(levels);
    }

    public static LogFilter none() {
        return new LogFilter(List.of(), null, null);
    }

    public static LogFilter atLeast(LogLevel minimum) {
        List<LogLevel> kept = List.of(LogLevel.values()).subList(minimum.ordinal(), LogLevel.values().length);
        return new LogFilter(kept, null, null);
    }

    public LogFilter withTag(String tag) {
        return new LogFilter(levels, tag, text);
    }

    public LogFilter withText(String text) {
        return new LogFilter(levels, tag, text);
    }
}
