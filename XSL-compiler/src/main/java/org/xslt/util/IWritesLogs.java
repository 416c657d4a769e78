package org.xslt.util;

/** Marker for classes whose logging level can be controlled with {@link Logger#setLoggingLevel}. */
public interface IWritesLogs {}
