package org.wordscope.core.lookup;

/**
 * One capability in a fallback cascade, for example "ranking cache" or "durable store".
 *
 * <p>Implementations never throw for adapter failures; they report them as {@link Lookup#error(Exception)}.</p>
 */
public interface LookupStage<K, V> {
    String name();

    Lookup<V> lookup(K key);
}
