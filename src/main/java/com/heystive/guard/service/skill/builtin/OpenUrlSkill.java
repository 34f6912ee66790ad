package com.heystive.guard.service.skill.builtin;

import com.heystive.guard.service.skill.Skill;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Accepts {@code "open <http(s) url>"} and returns an open-url action for the client.
 * Nothing is opened on the server.
 */
public final class OpenUrlSkill implements Skill {

    private static final Pattern URL = Pattern.compile("(https?://[\\w.-]+[\\w\\-/.?=#%&+]*)",
            Pattern.CASE_INSENSITIVE);

    @Override
    public String name() {
        return "open_url";
    }

    @Override
    public String description() {
        return "Opens a web address (\"open https://...\")";
    }

    @Override
    public boolean canHandle(String text) {
        String t = text.toLowerCase(Locale.ROOT);
        return t.startsWith("open ") && URL.matcher(t).find();
    }

    @Override
    public Map<String, Object> handle(String text, Map<String, Object> args) {
        Object direct = args.get("url");
        Matcher m = URL.matcher(direct != null ? direct.toString() : text);
        Map<String, Object> result = new LinkedHashMap<>();
        if (!m.find()) {
            result.put("accepted", false);
            return result;
        }
        result.put("accepted", true);
        result.put("action", "open_url");
        result.put("url", m.group(1));
        return result;
    }
}
