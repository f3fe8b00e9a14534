/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.session;

public enum SessionStatus {
    /** Normal operation. */
    ACTIVE,
    /** The attached engine failed to resume this session; its puppet binding was cleared. */
    UNBOUND
}
