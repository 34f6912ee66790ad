package com.heystive.guard.service.skill.builtin;

import com.heystive.guard.service.skill.Skill;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Remembers short notes: {@code "note: buy milk"} or {@code "remember call mom"}.
 * Notes are kept in memory for the lifetime of the process.
 */
public final class NoteSkill implements Skill {

    private static final Pattern NOTE = Pattern.compile("^(note|remember)[: ]+(.*)$",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    /** A saved note. */
    public record Note(long id, long timestampMillis, String text) {
    }

    private final Clock clock;
    private final AtomicLong ids = new AtomicLong();
    private final List<Note> notes = new ArrayList<>();

    public NoteSkill(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String name() {
        return "note";
    }

    @Override
    public String description() {
        return "Saves a note (\"note: ...\" or \"remember ...\")";
    }

    @Override
    public boolean canHandle(String text) {
        return NOTE.matcher(text.strip()).matches();
    }

    @Override
    public Map<String, Object> handle(String text, Map<String, Object> args) {
        String body = extract(text, args);
        Map<String, Object> result = new LinkedHashMap<>();
        if (body == null || body.isBlank()) {
            result.put("saved", false);
            return result;
        }
        Note note = new Note(ids.incrementAndGet(), clock.millis(), body.strip());
        synchronized (notes) {
            notes.add(note);
        }
        result.put("saved", true);
        result.put("id", note.id());
        result.put("text", note.text());
        return result;
    }

    /**
     * Returns a copy of the saved notes, oldest first.
     */
    public List<Note> notes() {
        synchronized (notes) {
            return List.copyOf(notes);
        }
    }

    private static String extract(String text, Map<String, Object> args) {
        Object direct = args.get("note");
        if (direct != null) {
            return direct.toString();
        }
        Matcher m = NOTE.matcher(text.strip());
        return m.matches() ? m.group(2) : null;
    }
}
