/*
 *  Copyright Nomura Research Institute, Ltd.
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */
package jp.openstandia.connector.scf;

/**
 * Terminal outcome of a successful lifecycle operation. Fatal outcomes are thrown as {@link ScfLifecycleException}.
 */
public final class LifecycleResult {

    public enum Kind {
        CREATED,
        PRESENT,
        /**
         * The resource no longer exists, the caller must discard its persisted state.
         */
        REMOVED,
        UPDATED,
        DELETED
    }

    private final Kind kind;
    private final ScfState state;

    private LifecycleResult(Kind kind, ScfState state) {
        this.kind = kind;
        this.state = state;
    }

    public static LifecycleResult created(ScfState state) {
        return new LifecycleResult(Kind.CREATED, state);
    }

    public static LifecycleResult present(ScfState state) {
        return new LifecycleResult(Kind.PRESENT, state);
    }

    public static LifecycleResult removed() {
        return new LifecycleResult(Kind.REMOVED, null);
    }

    public static LifecycleResult updated(ScfState state) {
        return new LifecycleResult(Kind.UPDATED, state);
    }

    public static LifecycleResult deleted() {
        return new LifecycleResult(Kind.DELETED, null);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return the new state, null for REMOVED and DELETED
     */
    public ScfState getState() {
        return state;
    }

    public boolean hasState() {
        return state != null;
    }

    @Override
    public String toString() {
        return kind + (state == null ? "" : "(" + state + ")");
    }
}
