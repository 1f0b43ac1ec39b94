package io.homefinder.kernel;

/**
 * Primitive iterator over property ids.
 */
public interface IntEnumerator {
    boolean hasNext();

    int nextInt();
}
