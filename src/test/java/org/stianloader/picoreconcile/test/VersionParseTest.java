package org.stianloader.picoreconcile.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.jetbrains.annotations.NotNull;
import org.junit.jupiter.api.Test;
import org.stianloader.picoreconcile.logging.LoggingAdapter;
import org.stianloader.picoreconcile.version.Version;
import org.stianloader.picoreconcile.version.VersionConstraint;
import org.stianloader.picoreconcile.version.VersionInterval;
import org.stianloader.picoreconcile.version.VersionParse;

public class VersionParseTest {

    private static class RecordingLogger extends LoggingAdapter {
        private final List<String> warnings = new ArrayList<>();

        @Override
        public void debug(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
            // Not of interest
        }

        @Override
        public void warn(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
            this.warnings.add(message);
        }
    }

    private boolean contains(@NotNull String constraint, @NotNull String version) {
        VersionConstraint parsed = VersionParse.versionConstraint(constraint);
        assertTrue(parsed.hasInterval(), constraint);
        return parsed.interval().contains(Version.parse(version));
    }

    @Test
    public void testIntervalTypes() {
        assertFalse(contains("[4.0.2,4.0.4]", "4.0.5"));
        assertTrue(contains("[4.0.2,4.0.4]", "4.0.4"));
        assertTrue(contains("[4.0.2,4.0.4]", "4.0.3"));
        assertTrue(contains("[4.0.2,4.0.4]", "4.0.2"));
        assertFalse(contains("[4.0.2,4.0.4]", "4.0.1"));

        assertFalse(contains("[4.0.2,4.0.4)", "4.0.4"));
        assertTrue(contains("[4.0.2,4.0.4)", "4.0.2"));

        assertTrue(contains("(4.0.2,4.0.4]", "4.0.4"));
        assertFalse(contains("(4.0.2,4.0.4]", "4.0.2"));

        assertFalse(contains("(4.0.2,4.0.4)", "4.0.4"));
        assertTrue(contains("(4.0.2,4.0.4)", "4.0.3"));
        assertFalse(contains("(4.0.2,4.0.4)", "4.0.2"));
    }

    @Test
    public void testUnboundedIntervals() {
        assertTrue(contains("[1,)", "1"));
        assertTrue(contains("[1,)", "5"));
        assertFalse(contains("[1,)", "0.1"));
        assertFalse(contains("(1,)", "1"));

        assertTrue(contains("(,1]", "1"));
        assertTrue(contains("(,1]", "0.1"));
        assertFalse(contains("(,1]", "5"));
        assertFalse(contains("(,1)", "1"));

        // An empty lower bound is no bound at all
        VersionInterval interval = VersionParse.versionInterval("[0,1.0)");
        assertNotNull(interval);
        assertNull(interval.getFrom());
        assertEquals(Version.parse("1.0"), interval.getTo());
        assertTrue(interval.isFromIncluded());
        assertFalse(interval.isToIncluded());
        assertTrue(interval.contains(Version.parse("0-rc1")));

        VersionInterval lowerOpen = VersionParse.versionInterval("(1.0,]");
        assertNotNull(lowerOpen);
        assertEquals(Version.parse("1.0"), lowerOpen.getFrom());
        assertNull(lowerOpen.getTo());
        assertFalse(lowerOpen.isFromIncluded());
        assertTrue(lowerOpen.isToIncluded());
    }

    @Test
    public void testPin() {
        assertTrue(contains("[1.0]", "1.0"));
        assertTrue(contains("[1.0]", "1.0.0"));
        assertFalse(contains("[1.0]", "1.0.1"));
        assertEquals("[1.0]", VersionParse.versionConstraint("[1.0]").toString());
    }

    @Test
    public void testPreferredVersion() {
        VersionConstraint constraint = VersionParse.versionConstraint("1.2");
        assertFalse(constraint.hasInterval());
        assertEquals(Collections.singletonList(Version.parse("1.2")), constraint.preferred());
        assertEquals("1.2", constraint.toString());
    }

    @Test
    public void testLatestSubRevision() {
        VersionConstraint constraint = VersionParse.versionConstraint("1.2.+");
        assertTrue(constraint.hasInterval());
        assertEquals("[1.2,1.3)", constraint.interval().getRepr());
        assertTrue(contains("1.2.+", "1.2"));
        assertTrue(contains("1.2.+", "1.2.9"));
        assertFalse(contains("1.2.+", "1.2-rc1"));
        assertFalse(contains("1.2.+", "1.3"));

        assertNull(VersionParse.ivyLatestSubRevisionInterval("1.0-rc.+"));
        assertNull(VersionParse.ivyLatestSubRevisionInterval("1.2"));
    }

    @Test
    public void testMultipleIntervals() {
        VersionConstraint constraint = VersionParse.versionConstraint("[1.0,),(,2.0)");
        assertTrue(constraint.hasInterval());
        assertEquals("[1.0,2.0)", constraint.interval().getRepr());
        assertTrue(contains("[1.0,),(,2.0)", "1.5"));
        assertFalse(contains("[1.0,),(,2.0)", "2.0"));
        assertFalse(contains("[1.0,),(,2.0)", "0.9"));
    }

    @Test
    public void testMerge() {
        VersionInterval a = Objects.requireNonNull(VersionParse.versionInterval("[1,3)"));
        VersionInterval b = Objects.requireNonNull(VersionParse.versionInterval("[2,4]"));
        assertEquals("[2,3)", Objects.requireNonNull(a.merge(b)).getRepr());
        assertEquals("[2,3)", Objects.requireNonNull(b.merge(a)).getRepr());

        VersionInterval c = Objects.requireNonNull(VersionParse.versionInterval("[1,2)"));
        VersionInterval d = Objects.requireNonNull(VersionParse.versionInterval("[2,3]"));
        assertNull(c.merge(d));

        VersionInterval e = Objects.requireNonNull(VersionParse.versionInterval("[1,2]"));
        assertEquals("[2]", Objects.requireNonNull(e.merge(d)).getRepr());
    }

    @Test
    public void testMalformedConstraints() {
        LoggingAdapter previous = LoggingAdapter.getDefaultLogger();
        RecordingLogger logger = new RecordingLogger();
        LoggingAdapter.setDefaultLogger(logger);
        try {
            assertEquals(VersionConstraint.EMPTY, VersionParse.versionConstraint("[1.0,1.5),[2.0,3.0)"));
            assertEquals(VersionConstraint.EMPTY, VersionParse.versionConstraint("[2.0,1.0]"));
            assertEquals(VersionConstraint.EMPTY, VersionParse.versionConstraint("(1.0"));
            assertEquals(VersionConstraint.EMPTY, VersionParse.versionConstraint("foo bar"));
            assertEquals(4, logger.warnings.size());

            // The empty string is a legitimate constraint
            assertEquals(VersionConstraint.EMPTY, VersionParse.versionConstraint(""));
            assertEquals(4, logger.warnings.size());
        } finally {
            LoggingAdapter.setDefaultLogger(previous);
        }

        assertNull(VersionParse.version("1.0 "));
        assertNull(VersionParse.version(""));
        assertNull(VersionParse.versionInterval("[1.0"));
        assertFalse(VersionConstraint.EMPTY.hasInterval());
        assertTrue(VersionConstraint.EMPTY.preferred().isEmpty());
    }
}
