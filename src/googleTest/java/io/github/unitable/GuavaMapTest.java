package io.github.unitable;

import com.google.common.collect.testing.MapTestSuiteBuilder;
import com.google.common.collect.testing.SampleElements;
import com.google.common.collect.testing.TestMapGenerator;
import com.google.common.collect.testing.features.CollectionFeature;
import com.google.common.collect.testing.features.CollectionSize;
import com.google.common.collect.testing.features.MapFeature;
import junit.framework.Test;
import junit.framework.TestCase;
import junit.framework.TestSuite;
import org.jspecify.annotations.NullMarked;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

@NullMarked
public final class GuavaMapTest extends TestCase {

    public static Test suite() {
        var suite = new TestSuite();
        suite.addTest(mapTest("UniversalHashTable", generator(UniversalHashTable::new)));
        suite.addTest(mapTest("UniversalHashTable cap=2", generator(() -> new UniversalHashTable(2))));
        suite.addTest(mapTest("UniversalHashTable lf=0.5",
            generator(() -> new UniversalHashTable(16, 0.5d, 0.125d))));
        return suite;
    }

    private static Test mapTest(String name, TestMapGenerator<?, ?> generator) {
        // null keys and null values are rejected with NullPointerException
        return MapTestSuiteBuilder
            .using(generator)
            .named(name)
            .withFeatures(
                CollectionSize.ANY,
                MapFeature.GENERAL_PURPOSE,
                CollectionFeature.NON_STANDARD_TOSTRING,
                CollectionFeature.SUPPORTS_ITERATOR_REMOVE)
            .createTestSuite();
    }

    private static TestMapGenerator<Key, Value> generator(Supplier<UniversalHashTable> supplier) {
        return new TestMapGenerator<>() {
            @Override
            public SampleElements<Map.Entry<Key, Value>> samples() {
                return new SampleElements<>(
                    Map.entry(Key.of(1), Value.ofInt32(10)),
                    Map.entry(Key.of("apple"), Value.ofString("red")),
                    Map.entry(Key.of(-7), Value.ofDouble(2.5d)),
                    Map.entry(Key.of("banana"), Value.ofBlob(new byte[] { 1, 2, 3 })),
                    Map.entry(Key.of(16), Value.ofChar('z')));
            }

            @Override
            public Map<Key, Value> create(Object... entries) {
                UniversalHashTable table = supplier.get();
                for (Object o : entries) {
                    @SuppressWarnings("unchecked")
                    Map.Entry<Key, Value> e = (Map.Entry<Key, Value>) o;
                    table.insert(e.getKey(), e.getValue());
                }
                return table;
            }

            @Override
            @SuppressWarnings("unchecked")
            public Map.Entry<Key, Value>[] createArray(int length) {
                return (Map.Entry<Key, Value>[]) new Map.Entry<?, ?>[length];
            }

            @Override
            public Iterable<Map.Entry<Key, Value>> order(List<Map.Entry<Key, Value>> insertionOrder) {
                return insertionOrder;
            }

            @Override
            public Key[] createKeyArray(int length) {
                return new Key[length];
            }

            @Override
            public Value[] createValueArray(int length) {
                return new Value[length];
            }
        };
    }
}
