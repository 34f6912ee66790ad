package com.heystive.guard.service.skill.builtin;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BuiltinSkillsTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-08-15T14:30:05Z"), ZoneOffset.UTC);

    @Nested
    class Calc {
        private final CalcSkill calc = new CalcSkill();

        @Test
        void claimsOnlyArithmetic() {
            assertThat(calc.canHandle("2 + 2")).isTrue();
            assertThat(calc.canHandle("(3*4)/2")).isTrue();
            assertThat(calc.canHandle("42")).isFalse();
            assertThat(calc.canHandle("what is 2+2")).isFalse();
            assertThat(calc.canHandle("")).isFalse();
        }

        @Test
        void returnsExpressionAndResult() {
            Map<String, Object> result = calc.handle("2 + 3 * 4", Map.of());

            assertThat(result).containsEntry("expression", "2 + 3 * 4").containsEntry("result", 14L);
        }

        @Test
        void expressionArgumentOverridesText() {
            assertThat(calc.handle("", Map.of("expression", "9-4"))).containsEntry("result", 5L);
        }

        @Test
        void rejectsNonArithmetic() {
            assertThatThrownBy(() -> calc.handle("import os", Map.of()))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    class Note {
        private final NoteSkill note = new NoteSkill(CLOCK);

        @Test
        void claimsNoteAndRememberPrefixes() {
            assertThat(note.canHandle("note: buy milk")).isTrue();
            assertThat(note.canHandle("Remember call mom")).isTrue();
            assertThat(note.canHandle("notebook prices")).isFalse();
        }

        @Test
        void savesNotesWithIncreasingIds() {
            Map<String, Object> first = note.handle("note: buy milk", Map.of());
            Map<String, Object> second = note.handle("remember call mom", Map.of());

            assertThat(first).containsEntry("saved", true).containsEntry("id", 1L).containsEntry("text", "buy milk");
            assertThat(second).containsEntry("id", 2L).containsEntry("text", "call mom");
            assertThat(note.notes()).extracting(NoteSkill.Note::text).containsExactly("buy milk", "call mom");
            assertThat(note.notes().get(0).timestampMillis()).isEqualTo(CLOCK.millis());
        }

        @Test
        void noteArgumentOverridesText() {
            assertThat(note.handle("", Map.of("note", "from plan"))).containsEntry("text", "from plan");
        }

        @Test
        void emptyNoteIsNotSaved() {
            assertThat(note.handle("hello", Map.of())).containsEntry("saved", false);
            assertThat(note.notes()).isEmpty();
        }
    }

    @Nested
    class Time {
        private final TimeSkill time = new TimeSkill(CLOCK);

        @Test
        void claimsTimeQuestions() {
            assertThat(time.canHandle("what TIME is it")).isTrue();
            assertThat(time.canHandle("set a clock")).isTrue();
            assertThat(time.canHandle("hello")).isFalse();
        }

        @Test
        void reportsUtcTime() {
            Map<String, Object> result = time.handle("time", Map.of());

            assertThat(result).containsEntry("time_iso", "2025-08-15T14:30:05Z");
            assertThat((String) result.get("time_human")).startsWith("2025-08-15 14:30:05");
        }
    }

    @Nested
    class OpenUrl {
        private final OpenUrlSkill open = new OpenUrlSkill();

        @Test
        void claimsOpenWithUrl() {
            assertThat(open.canHandle("open https://example.org/docs")).isTrue();
            assertThat(open.canHandle("open the door")).isFalse();
            assertThat(open.canHandle("visit https://example.org")).isFalse();
        }

        @Test
        void returnsActionWithoutOpeningAnything() {
            assertThat(open.handle("open https://example.org/a?b=1", Map.of()))
                    .containsEntry("accepted", true)
                    .containsEntry("action", "open_url")
                    .containsEntry("url", "https://example.org/a?b=1");
        }

        @Test
        void urlArgumentOverridesText() {
            assertThat(open.handle("", Map.of("url", "http://intranet.local/x")))
                    .containsEntry("url", "http://intranet.local/x");
            assertThat(open.handle("", Map.of("url", "ftp://nope"))).containsEntry("accepted", false);
        }
    }
}
