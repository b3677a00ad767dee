package io.github.cyfko.typemapper;

import io.github.cyfko.typemapper.dispatch.DispatchCache;
import io.github.cyfko.typemapper.dispatch.ElementTypeInferencer;
import io.github.cyfko.typemapper.dispatch.ElementTypeInferencer.InferredSequence;
import io.github.cyfko.typemapper.dispatch.ErasedInvoker;
import io.github.cyfko.typemapper.dispatch.SequenceInvoker;

import java.util.Iterator;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * {@link TypeMapper} backed by a {@link MapperRegistry} and two {@link DispatchCache}s, one for
 * single values and one for sequences.
 *
 * <p>
 * Instances own their caches; nothing is shared between two mappers built from different
 * registries.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class DefaultTypeMapper implements TypeMapper {

    private final MapperRegistry registry;
    private final DispatchCache<ErasedInvoker> valueInvokers;
    private final DispatchCache<SequenceInvoker> sequenceInvokers;

    public DefaultTypeMapper(MapperRegistry registry) {
        this(registry, DispatchCache.DEFAULT_MAX_ENTRIES);
    }

    /**
     * @param registry         registry to resolve mappers from; must not be {@code null}
     * @param maxCachedEntries soft ceiling of each dispatch cache; must be at least 1
     */
    public DefaultTypeMapper(MapperRegistry registry, int maxCachedEntries) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.valueInvokers = new DispatchCache<>(maxCachedEntries);
        this.sequenceInvokers = new DispatchCache<>(maxCachedEntries);
    }

    public MapperRegistry registry() {
        return registry;
    }

    @Override
    public <D> D map(Object source, Class<D> destinationType) {
        Objects.requireNonNull(source, "source cannot be null");
        TypePairKey key = TypePairKey.of(source.getClass(), destinationType);

        ErasedInvoker invoker = valueInvokers.get(key, this::valueInvoker);
        return destinationType.cast(invoker.invoke(source));
    }

    @Override
    public <S, D> D map(S source, Class<S> sourceType, Class<D> destinationType) {
        Objects.requireNonNull(source, "source cannot be null");
        return registry.resolve(sourceType, destinationType).map(source);
    }

    @Override
    public <D> Stream<D> mapAll(Iterable<?> sources, Class<D> destinationType) {
        return mapInferred(sources, destinationType);
    }

    @Override
    public <D> Stream<D> mapAll(Object[] sources, Class<D> destinationType) {
        return mapInferred(sources, destinationType);
    }

    @Override
    public <S, D> Stream<D> mapAll(Iterable<? extends S> sources, Class<S> sourceType, Class<D> destinationType) {
        Objects.requireNonNull(sources, "sources cannot be null");
        Mapper<S, D> mapper = registry.resolve(sourceType, destinationType);

        return StreamSupport.stream(sources.spliterator(), false)
                .filter(Objects::nonNull)
                .map(mapper::map);
    }

    private <D> Stream<D> mapInferred(Object sources, Class<D> destinationType) {
        Objects.requireNonNull(sources, "sources cannot be null");
        Objects.requireNonNull(destinationType, "destinationType cannot be null");

        InferredSequence sequence = ElementTypeInferencer.open(sources);
        TypePairKey key = TypePairKey.of(sequence.elementType(), destinationType);

        SequenceInvoker invoker = sequenceInvokers.get(key, this::sequenceInvoker);
        return invoker.invoke(sequence.elements()).map(destinationType::cast);
    }

    /**
     * Binds the erased view of the pair's mapper. The registry lookup stays inside the closure
     * so a mapper made available after a failed call is still found.
     */
    private ErasedInvoker valueInvoker(TypePairKey key) {
        return source -> apply(key.sourceType(), key.destinationType(), source);
    }

    private SequenceInvoker sequenceInvoker(TypePairKey key) {
        return elements -> applyEach(key.sourceType(), key.destinationType(), elements);
    }

    private <S, D> D apply(Class<S> sourceType, Class<D> destinationType, Object source) {
        return registry.resolve(sourceType, destinationType).map(sourceType.cast(source));
    }

    /**
     * Resolves the mapper before returning, so a missing mapper fails the call rather than the
     * first read of the stream.
     */
    private <S, D> Stream<Object> applyEach(Class<S> sourceType, Class<D> destinationType, Iterator<?> elements) {
        Mapper<S, D> mapper = registry.resolve(sourceType, destinationType);
        return stream(elements)
                .filter(Objects::nonNull)
                .<Object>map(element -> mapper.map(sourceType.cast(element)));
    }

    private static Stream<Object> stream(Iterator<?> elements) {
        Spliterator<Object> spliterator = Spliterators.spliteratorUnknownSize(elements, Spliterator.ORDERED);
        return StreamSupport.stream(spliterator, false);
    }

    DispatchCache<ErasedInvoker> valueInvokers() {
        return valueInvokers;
    }

    DispatchCache<SequenceInvoker> sequenceInvokers() {
        return sequenceInvokers;
    }
}
