/**
 * Copyright Delegator Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.delegator.client.security.credentials;

import java.io.IOException;
import java.security.KeyPair;

/**
 * Persists the RSA key pair of a {@link WebIdentitySupplier} under a key id.
 */
public interface PrivateKeyStorage {

    /**
     * @param keyId the key id
     * @return the stored key pair, or null if none is stored under the id
     * @throws IOException if stored material exists but cannot be read
     */
    KeyPair load(String keyId) throws IOException;

    /**
     * Stores a key pair, replacing any pair stored under the same id.
     *
     * @param keyId   the key id
     * @param keyPair an RSA key pair
     * @throws IOException if the pair cannot be written
     */
    void store(String keyId, KeyPair keyPair) throws IOException;
}
