/*
 * Copyright 2026 The RowDelta Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.rowdelta.logging;

import java.util.ArrayList;
import java.util.List;

import junit.framework.TestCase;
import junit.framework.TestSuite;

/**
 * Tests for CommonsLog.
 *
 * @author RowDelta Authors
 */
public class TestCommonsLog extends TestCase {
    public static void main(String[] args) {
        junit.textui.TestRunner.run(suite());
    }

    public static TestSuite suite() {
        return new TestSuite(TestCommonsLog.class);
    }

    public TestCommonsLog(String name) {
        super(name);
    }

    public void testDefaultLevel() {
        assertEquals(CommonsLog.Level.DEBUG, new CommonsLog(getClass()).getLevel());
    }

    public void testLevels() {
        RecordingLog log = new RecordingLog("debug");

        CommonsLog debug = new CommonsLog(log, CommonsLog.Level.DEBUG);
        assertTrue(debug.isEnabled());
        debug.write("a");

        CommonsLog info = new CommonsLog(log, CommonsLog.Level.INFO);
        assertTrue(info.isEnabled());
        info.write("b");

        CommonsLog warn = new CommonsLog(log, CommonsLog.Level.WARN);
        assertTrue(warn.isEnabled());
        warn.write("c");

        CommonsLog trace = new CommonsLog(log, CommonsLog.Level.TRACE);
        assertFalse(trace.isEnabled());
        trace.write("d");

        assertEquals("[debug:a, info:b, warn:c, trace:d]", log.mRecords.toString());
    }

    public void testThreshold() {
        RecordingLog log = new RecordingLog("warn");
        assertFalse(new CommonsLog(log, CommonsLog.Level.DEBUG).isEnabled());
        assertFalse(new CommonsLog(log, CommonsLog.Level.INFO).isEnabled());
        assertTrue(new CommonsLog(log, CommonsLog.Level.WARN).isEnabled());
    }

    public void testNulls() {
        try {
            new CommonsLog(null, CommonsLog.Level.INFO);
            fail();
        } catch (IllegalArgumentException e) {
        }
        try {
            new CommonsLog(new RecordingLog("info"), null);
            fail();
        } catch (IllegalArgumentException e) {
        }
    }

    public void testListenerLevel() {
        new LoggingChangeListener<Object>(CommonsLog.Level.INFO);
        try {
            new LoggingChangeListener<Object>((CommonsLog.Level) null);
            fail();
        } catch (IllegalArgumentException e) {
        }
    }

    /**
     * Records messages and enables levels at or above a threshold.
     */
    private static class RecordingLog implements org.apache.commons.logging.Log {
        private static final String[] LEVELS = {
            "trace", "debug", "info", "warn", "error", "fatal"
        };

        final List<String> mRecords = new ArrayList<String>();
        private final int mThreshold;

        RecordingLog(String threshold) {
            int index = 0;
            while (!LEVELS[index].equals(threshold)) {
                index++;
            }
            mThreshold = index;
        }

        private boolean enabled(int level) {
            return level >= mThreshold;
        }

        private void record(int level, Object message) {
            mRecords.add(LEVELS[level] + ':' + message);
        }

        public boolean isTraceEnabled() { return enabled(0); }
        public boolean isDebugEnabled() { return enabled(1); }
        public boolean isInfoEnabled() { return enabled(2); }
        public boolean isWarnEnabled() { return enabled(3); }
        public boolean isErrorEnabled() { return enabled(4); }
        public boolean isFatalEnabled() { return enabled(5); }

        public void trace(Object message) { record(0, message); }
        public void trace(Object message, Throwable t) { record(0, message); }
        public void debug(Object message) { record(1, message); }
        public void debug(Object message, Throwable t) { record(1, message); }
        public void info(Object message) { record(2, message); }
        public void info(Object message, Throwable t) { record(2, message); }
        public void warn(Object message) { record(3, message); }
        public void warn(Object message, Throwable t) { record(3, message); }
        public void error(Object message) { record(4, message); }
        public void error(Object message, Throwable t) { record(4, message); }
        public void fatal(Object message) { record(5, message); }
        public void fatal(Object message, Throwable t) { record(5, message); }
    }
}
