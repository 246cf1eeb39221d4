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

import org.rowdelta.ChangeListener;
import org.rowdelta.ChangeVisitor;
import org.rowdelta.FetchedResultsController;
import org.rowdelta.RowChange;
import org.rowdelta.SectionChange;

/**
 * Listener which logs every change reported by a controller. By default, all
 * messages are logged through Commons Logging at the debug level.
 *
 * <pre>
 * controller.addListener(new LoggingChangeListener&lt;Object&gt;());
 * </pre>
 *
 * @author RowDelta Authors
 */
public class LoggingChangeListener<S> extends ChangeListener<S> {
    private final Log mLog;

    public LoggingChangeListener() {
        this(new CommonsLog(LoggingChangeListener.class));
    }

    /**
     * Logs through Commons Logging at the given level.
     */
    public LoggingChangeListener(CommonsLog.Level level) {
        this(new CommonsLog(org.apache.commons.logging.LogFactory
                            .getLog(LoggingChangeListener.class), level));
    }

    public LoggingChangeListener(Log log) {
        if (log == null) {
            throw new IllegalArgumentException();
        }
        mLog = log;
    }

    @Override
    public void willChangeContent(FetchedResultsController<? extends S> controller) {
        if (mLog.isEnabled()) {
            mLog.write("willChangeContent on " + name(controller));
        }
    }

    @Override
    public void didChangeSection(FetchedResultsController<? extends S> controller,
                                 SectionChange change)
    {
        if (mLog.isEnabled()) {
            mLog.write(change.accept(Describer.THE, null) + " on " + name(controller));
        }
    }

    @Override
    public void didChangeObject(FetchedResultsController<? extends S> controller,
                                RowChange change)
    {
        if (mLog.isEnabled()) {
            mLog.write(change.accept(Describer.THE, null) + " on " + name(controller));
        }
    }

    @Override
    public void didChangeContent(FetchedResultsController<? extends S> controller) {
        if (mLog.isEnabled()) {
            mLog.write("didChangeContent on " + name(controller) + ", now "
                       + controller.numberOfSections() + " sections");
        }
    }

    private static String name(FetchedResultsController<?> controller) {
        String name = controller.getCacheName();
        return name == null ? controller.getFetchRequest().getObjectType().getName() : name;
    }

    private static class Describer extends ChangeVisitor<String, Object> {
        static final Describer THE = new Describer();

        @Override
        public String visit(SectionChange.Insert change, Object param) {
            return "Section.insert(\"" + change.getSectionName() + "\") at "
                + change.getIndex();
        }

        @Override
        public String visit(SectionChange.Delete change, Object param) {
            return "Section.delete(\"" + change.getSectionName() + "\") at "
                + change.getIndex();
        }

        @Override
        public String visit(RowChange.Insert change, Object param) {
            return "Row.insert(" + change.getRow().getId() + ") at " + change.getIndexPath();
        }

        @Override
        public String visit(RowChange.Delete change, Object param) {
            return "Row.delete(" + change.getRow().getId() + ") at " + change.getIndexPath();
        }

        @Override
        public String visit(RowChange.Move change, Object param) {
            return "Row.move(" + change.getRow().getId() + ") from "
                + change.getFromIndexPath() + " to " + change.getToIndexPath();
        }

        @Override
        public String visit(RowChange.Update change, Object param) {
            return "Row.update(" + change.getRow().getId() + ") at " + change.getIndexPath();
        }
    }
}
