package com.heystive.guard.service.skill.builtin;

import com.heystive.guard.service.skill.Skill;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Reports the current UTC time.
 */
public final class TimeSkill implements Skill {

    private static final DateTimeFormatter HUMAN = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");

    private final Clock clock;

    public TimeSkill(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String name() {
        return "time";
    }

    @Override
    public String description() {
        return "Tells the current time";
    }

    @Override
    public boolean canHandle(String text) {
        String t = text.toLowerCase(Locale.ROOT);
        return t.contains("time") || t.contains("clock");
    }

    @Override
    public Map<String, Object> handle(String text, Map<String, Object> args) {
        ZonedDateTime now = ZonedDateTime.now(clock.withZone(ZoneOffset.UTC));
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("time_iso", now.toOffsetDateTime().toString());
        result.put("time_human", now.format(HUMAN));
        return result;
    }
}
