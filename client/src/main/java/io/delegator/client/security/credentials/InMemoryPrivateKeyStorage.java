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

import java.security.KeyPair;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Keeps key pairs for the lifetime of the process only.
 */
public class InMemoryPrivateKeyStorage implements PrivateKeyStorage {
    private final ConcurrentMap<String, KeyPair> keyPairs = new ConcurrentHashMap<>();

    @Override
    public KeyPair load(String keyId) {
        return keyPairs.get(keyId);
    }

    @Override
    public void store(String keyId, KeyPair keyPair) {
        keyPairs.put(keyId, keyPair);
    }
}
