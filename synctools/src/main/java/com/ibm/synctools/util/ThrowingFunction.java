/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: synctools
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.synctools.util;

/**
 * A {@link java.util.function.Function} analogue whose application may throw a checked exception
 * of type {@code X}.
 *
 * @param <T> the argument type
 * @param <R> the result type
 * @param <X> the type of throwable the function may raise
 */
@FunctionalInterface
public interface ThrowingFunction<T, R, X extends Throwable> {

  /**
   * Applies this function to the given argument.
   *
   * @param t the function argument
   * @return the function result
   * @throws X if the function fails
   */
  R apply(T t) throws X;
}
