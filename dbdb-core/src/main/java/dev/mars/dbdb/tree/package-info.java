/*
 * Copyright 2026 Mark Andrew Ray-Smith
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
/**
 * Copy-on-write binary search tree whose nodes are loaded from storage on demand.
 * <p>
 * {@link dev.mars.dbdb.tree.NodeRef} and {@link dev.mars.dbdb.tree.ValueRef} point
 * at records by address and decode them the first time they are followed.
 * {@link dev.mars.dbdb.tree.BinaryTree} never changes a node; it builds new
 * nodes along the path it modifies and shares the rest.
 */
package dev.mars.dbdb.tree;
