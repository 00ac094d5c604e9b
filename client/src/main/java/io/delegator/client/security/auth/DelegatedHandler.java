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
package io.delegator.client.security.auth;

import java.util.concurrent.CompletableFuture;

/**
 * A handler wrapped by {@link AuthProvider#grant}: exchanges the caller's token, then runs the wrapped logic.
 *
 * @param <C> Identity context type.
 * @param <T> Result type.
 */
@FunctionalInterface
public interface DelegatedHandler<C extends IdentityContext, T> {

    /**
     * @param identity the caller
     * @param args     extra arguments, used by reflectively bound handlers only
     * @return the wrapped handler's result; fails only if the wrapped handler itself throws
     */
    CompletableFuture<T> handle(C identity, Object... args);
}
