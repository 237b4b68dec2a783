package org.pragmatica.triple.serialization.kryo;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.util.DefaultInstantiatorStrategy;
import com.esotericsoftware.kryo.util.Pool;
import org.objenesis.strategy.StdInstantiatorStrategy;
import org.pragmatica.triple.serialization.ClassRegistrator;

public sealed interface KryoPoolFactory {

    /**
     * Pool of Kryo instances, {@code 2 * processors} deep. Kryo itself is not thread-safe.
     * Every class written or read must be registered.
     */
    static Pool<Kryo> kryoPool(ClassRegistrator... registrators) {
        return new Pool<>(true, false, Runtime.getRuntime().availableProcessors() * 2) {
            @Override
            protected Kryo create() {
                var kryo = new Kryo();

                kryo.setRegistrationRequired(true);
                kryo.setReferences(true);
                kryo.setInstantiatorStrategy(new DefaultInstantiatorStrategy(new StdInstantiatorStrategy()));

                for (var registrator : registrators) {
                    registrator.registerClasses(kryo::register);
                }

                return kryo;
            }
        };
    }

    @SuppressWarnings("unused")
    record unused() implements KryoPoolFactory {}
}
