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

/**
 * Log implementation that writes change events to Jakarta Commons Logging at
 * a chosen level, debug by default.
 *
 * @author RowDelta Authors
 */
public class CommonsLog implements Log {
    /**
     * Commons Logging level which change events are written at.
     */
    public enum Level {
        TRACE, DEBUG, INFO, WARN
    }

    private final org.apache.commons.logging.Log mLog;
    private final Level mLevel;

    /**
     * Writes to the log of the given class at debug level.
     */
    public CommonsLog(Class<?> clazz) {
        this(org.apache.commons.logging.LogFactory.getLog(clazz), Level.DEBUG);
    }

    public CommonsLog(org.apache.commons.logging.Log log, Level level) {
        if (log == null) {
            throw new IllegalArgumentException("Log cannot be null");
        }
        if (level == null) {
            throw new IllegalArgumentException("Level cannot be null");
        }
        mLog = log;
        mLevel = level;
    }

    public Level getLevel() {
        return mLevel;
    }

    public boolean isEnabled() {
        switch (mLevel) {
        case TRACE:
            return mLog.isTraceEnabled();
        case DEBUG: default:
            return mLog.isDebugEnabled();
        case INFO:
            return mLog.isInfoEnabled();
        case WARN:
            return mLog.isWarnEnabled();
        }
    }

    public void write(String message) {
        switch (mLevel) {
        case TRACE:
            mLog.trace(message);
            break;
        case DEBUG: default:
            mLog.debug(message);
            break;
        case INFO:
            mLog.info(message);
            break;
        case WARN:
            mLog.warn(message);
            break;
        }
    }
}
