/*
 * Copyright 2009-2011, Qualcomm Innovation Center, Inc.
 *
 *    Licensed under the Apache License, Version 2.0 (the "License");
 *    you may not use this file except in compliance with the License.
 *    You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 *    Unless required by applicable law or agreed to in writing, software
 *    distributed under the License is distributed on an "AS IS" BASIS,
 *    WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *    See the License for the specific language governing permissions and
 *    limitations under the License.
 */

package org.jsdbus;

import java.util.Arrays;
import java.util.Objects;

/**
 * A value paired with the wire signature it is marshalled with.  Variants
 * carry property values in Properties.Get and Properties.Set messages.
 */
public final class Variant {

    private final String signature;

    private final Object value;

    /**
     * Constructs a Variant.
     *
     * @param signature the wire signature of the value
     * @param value the value
     */
    public Variant(String signature, Object value) {
        this.signature = signature;
        this.value = value;
    }

    /**
     * Gets the signature of the contained value.
     *
     * @return the signature
     */
    public String getSignature() {
        return signature;
    }

    /**
     * Gets the contained value.
     *
     * @return the value
     */
    public Object getObject() {
        return value;
    }

    /**
     * Gets the contained value as the given type.
     *
     * @param type the expected Java type
     * @return the value
     * @throws MarshalBusException if the value is not of that type
     */
    public <T> T getObject(Class<T> type) throws MarshalBusException {
        if (value != null && !type.isInstance(value)) {
            throw new MarshalBusException("cannot marshal '" + signature + "' into " + type.getName());
        }
        return type.cast(value);
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof Variant)) {
            return false;
        }
        Variant other = (Variant) obj;
        return Objects.equals(signature, other.signature)
            && Arrays.deepEquals(new Object[] { value }, new Object[] { other.value });
    }

    @Override
    public int hashCode() {
        return Objects.hash(signature) * 31 + Arrays.deepHashCode(new Object[] { value });
    }

    @Override
    public String toString() {
        return "Variant(" + signature + ", "
            + (value instanceof Object[] ? Arrays.deepToString((Object[]) value) : String.valueOf(value)) + ")";
    }
}
