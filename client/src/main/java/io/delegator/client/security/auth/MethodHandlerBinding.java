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

import com.google.common.base.Preconditions;
import io.delegator.auth.AuthProviderConfigurationException;
import io.delegator.auth.MissingAccessContextException;
import io.delegator.auth.MissingIdentityContextException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Binds a handler method found by name. The method must declare one {@link IdentityContext} parameter (or subtype)
 * and one {@link AccessContext} parameter; any other parameters are filled from the invocation arguments, in order.
 */
final class MethodHandlerBinding {
    private final Object target;
    private final Method method;
    private final int identityIndex;
    private final int accessContextIndex;

    private MethodHandlerBinding(Object target, Method method, int identityIndex, int accessContextIndex) {
        this.target = target;
        this.method = method;
        this.identityIndex = identityIndex;
        this.accessContextIndex = accessContextIndex;
    }

    /**
     * @throws MissingIdentityContextException if the method has no identity parameter
     * @throws MissingAccessContextException   if the method has no access context parameter
     * @throws AuthProviderConfigurationException if no single public method has the given name
     */
    static MethodHandlerBinding bind(Object target, String methodName) {
        Preconditions.checkNotNull(target, "target");
        Preconditions.checkNotNull(methodName, "methodName");
        List<Method> candidates = Arrays.stream(target.getClass().getMethods())
                .filter(m -> m.getName().equals(methodName))
                .collect(Collectors.toList());
        if (candidates.size() != 1) {
            throw new AuthProviderConfigurationException(String.format("Expected exactly one public method named %s "
                    + "on %s, found %d", methodName, target.getClass().getName(), candidates.size()));
        }
        Method method = candidates.get(0);
        Class<?>[] types = method.getParameterTypes();
        int identityIndex = -1;
        int accessContextIndex = -1;
        for (int i = 0; i < types.length; i++) {
            if (identityIndex < 0 && IdentityContext.class.isAssignableFrom(types[i])) {
                identityIndex = i;
            } else if (accessContextIndex < 0 && types[i] == AccessContext.class) {
                accessContextIndex = i;
            }
        }
        if (identityIndex < 0) {
            throw new MissingIdentityContextException("Method " + methodName
                    + " must declare an IdentityContext parameter to be granted delegated access");
        }
        if (accessContextIndex < 0) {
            throw new MissingAccessContextException("Method " + methodName
                    + " must declare an AccessContext parameter to be granted delegated access");
        }
        return new MethodHandlerBinding(target, method, identityIndex, accessContextIndex);
    }

    Class<?> getIdentityType() {
        return method.getParameterTypes()[identityIndex];
    }

    Object invoke(IdentityContext identity, AccessContext accessContext, Object[] args) throws Exception {
        Object[] extra = args == null ? new Object[0] : args;
        int parameterCount = method.getParameterCount();
        if (extra.length != parameterCount - 2) {
            throw new IllegalArgumentException(String.format("Method %s takes %d arguments besides the identity and "
                    + "access context, got %d", method.getName(), parameterCount - 2, extra.length));
        }
        if (identity != null && !getIdentityType().isInstance(identity)) {
            throw new IllegalArgumentException("Method " + method.getName() + " expects identity of type "
                    + getIdentityType().getName() + ", got " + identity.getClass().getName());
        }
        Object[] callArgs = new Object[parameterCount];
        int next = 0;
        for (int i = 0; i < parameterCount; i++) {
            if (i == identityIndex) {
                callArgs[i] = identity;
            } else if (i == accessContextIndex) {
                callArgs[i] = accessContext;
            } else {
                callArgs[i] = extra[next++];
            }
        }
        try {
            return method.invoke(target, callArgs);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        }
    }

    @Override
    public String toString() {
        return target.getClass().getSimpleName() + "#" + method.getName();
    }
}
