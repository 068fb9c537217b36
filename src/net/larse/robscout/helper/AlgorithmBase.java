/*
 * Copyright (c) 2015 Zhiqiang Yang.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package net.larse.robscout.helper;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.Arrays;

/**
 * Base for the algorithm argument holders.
 *
 * <p>Each algorithm keeps its options in a nested {@code Args} class with public, defaulted fields.
 * The fields are annotated with {@link ArgsBase.Doc} and, when the caller may leave them alone,
 * {@link ArgsBase.Optional}.
 */
public class AlgorithmBase {

  public static class ArgsBase {
    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.FIELD)
    public @interface Doc {
      String help();
    }

    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.FIELD)
    public @interface Optional {}

    /**
     * One line per documented field: name, current value, and whether it is optional.
     */
    public String describe() {
      StringBuilder sb = new StringBuilder(getClass().getSimpleName());
      for (Field field : getClass().getFields()) {
        if (Modifier.isStatic(field.getModifiers())) {
          continue;
        }
        Doc doc = field.getAnnotation(Doc.class);
        if (doc == null) {
          continue;
        }
        sb.append("\n  ");
        sb.append(field.getName());
        sb.append(" = ");
        sb.append(valueOf(field));
        if (field.getAnnotation(Optional.class) == null) {
          sb.append(" (required)");
        }
        sb.append("\t");
        sb.append(doc.help());
      }
      return sb.toString();
    }

    private String valueOf(Field field) {
      try {
        Object value = field.get(this);
        if (value instanceof double[]) {
          return Arrays.toString((double[]) value);
        }
        return String.valueOf(value);
      } catch (IllegalAccessException e) {
        throw new IllegalStateException("Unreadable argument " + field.getName(), e);
      }
    }
  }
}
