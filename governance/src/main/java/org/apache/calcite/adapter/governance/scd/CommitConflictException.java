/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.calcite.adapter.governance.scd;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * A commit found keys whose history changed since the merge read them.
 * Nothing was applied.
 */
public class CommitConflictException extends Exception {
  private static final long serialVersionUID = 1L;

  private final transient List<BusinessKey> keys;

  public CommitConflictException(String storeName, List<BusinessKey> keys) {
    super("Commit to " + storeName + " conflicts on " + keys.size() + " key(s): "
        + (keys.size() > 5 ? keys.subList(0, 5) + "..." : keys));
    this.keys = ImmutableList.copyOf(keys);
  }

  public List<BusinessKey> getKeys() {
    return keys;
  }
}
