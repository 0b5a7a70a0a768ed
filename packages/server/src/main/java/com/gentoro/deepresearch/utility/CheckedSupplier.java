package com.gentoro.deepresearch.utility;

/** A supplier whose computation may throw a checked exception. */
@FunctionalInterface
public interface CheckedSupplier<T> {
  T get() throws Exception;
}
