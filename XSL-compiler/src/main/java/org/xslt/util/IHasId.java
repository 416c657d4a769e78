package org.xslt.util;

/** An object with a numeric identity, unique among objects of the same family. */
public interface IHasId {
    long getId();
}
