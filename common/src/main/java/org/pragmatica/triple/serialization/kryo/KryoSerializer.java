package org.pragmatica.triple.serialization.kryo;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;
import com.esotericsoftware.kryo.util.Pool;
import org.pragmatica.triple.common.TripleError;
import org.pragmatica.triple.serialization.ClassRegistrator;
import org.pragmatica.triple.serialization.SerializerType;
import org.pragmatica.triple.serialization.TripleSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dynamic object-graph serializer backed by a pool of Kryo instances.
 */
public interface KryoSerializer extends TripleSerializer {
    int INITIAL_BUFFER_SIZE = 256;

    static KryoSerializer kryoSerializer(ClassRegistrator... registrators) {
        record kryoSerializer(Pool<Kryo> pool) implements KryoSerializer {
            private static final Logger log = LoggerFactory.getLogger(KryoSerializer.class);

            @Override
            public String type() {
                return SerializerType.KRYO;
            }

            @Override
            public byte[] marshal(Object message) {
                var kryo = pool.obtain();

                try (var output = new Output(INITIAL_BUFFER_SIZE, -1)) {
                    kryo.writeClassAndObject(output, message);
                    return output.toBytes();
                } catch (Exception e) {
                    log.error("Error serializing object {}", message, e);
                    throw new TripleError.CodecFailed("marshal", message, e).exception();
                } finally {
                    pool.free(kryo);
                }
            }

            @Override
            public <T> T unmarshal(byte[] data, Class<T> type) {
                var kryo = pool.obtain();

                try (var input = new Input(data)) {
                    return type.cast(kryo.readClassAndObject(input));
                } catch (Exception e) {
                    log.error("Error deserializing {} bytes", data.length, e);
                    throw new TripleError.CodecFailed("unmarshal", type.getName(), e).exception();
                } finally {
                    pool.free(kryo);
                }
            }
        }

        return new kryoSerializer(KryoPoolFactory.kryoPool(registrators));
    }
}
