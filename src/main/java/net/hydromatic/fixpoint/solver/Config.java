/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.fixpoint.solver;

import com.google.common.collect.ImmutableMap;
import java.io.File;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration of the solver.
 *
 * <p>A configuration is immutable; {@link #with} returns a new one.
 */
public class Config {
  /** Extension of a query file. */
  public static final String FQ_EXTENSION = ".fq";

  private static final Config EMPTY = new Config(ImmutableMap.of());

  private final ImmutableMap<Prop, Object> map;

  private Config(ImmutableMap<Prop, Object> map) {
    this.map = map;
  }

  /** Returns a configuration where every property has its default value. */
  public static Config of() {
    return EMPTY;
  }

  /** Returns a configuration with the given property values. */
  public static Config of(Map<Prop, Object> map) {
    Config config = EMPTY;
    for (Map.Entry<Prop, Object> entry : map.entrySet()) {
      config = config.with(entry.getKey(), entry.getValue());
    }
    return config;
  }

  /** Returns a copy of this configuration with one property changed. */
  public Config with(Prop prop, Object value) {
    final Map<Prop, Object> map = new LinkedHashMap<>(this.map);
    prop.set(map, value);
    return new Config(ImmutableMap.copyOf(map));
  }

  /** Returns a copy of this configuration with a given source file. */
  public Config withSrcFile(File srcFile) {
    return with(Prop.SRC_FILE, srcFile);
  }

  public File srcFile() {
    return Prop.SRC_FILE.fileValue(map);
  }

  public int undoAnfDepth() {
    return Prop.UNDO_ANF_DEPTH.intValue(map);
  }

  public int inlineDepth() {
    return Prop.INLINE_DEPTH.intValue(map);
  }

  public int lineWidth() {
    return Prop.LINE_WIDTH.intValue(map);
  }

  /**
   * Returns the file, in the temporary directory next to the source file,
   * whose name is the source file's name plus an extension.
   *
   * <p>For example, if the source file is "src/Foo.hs", the temporary
   * directory is ".liquid" and the extension is ".fq", returns
   * "src/.liquid/Foo.hs.fq".
   */
  public File queryFile(String extension) {
    final File srcFile = srcFile();
    final File parent = srcFile.getAbsoluteFile().getParentFile();
    final File tempDirectory =
        new File(parent, Prop.TEMP_DIRECTORY.stringValue(map));
    return new File(tempDirectory, srcFile.getName() + extension);
  }
}

// End Config.java
