/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: synctools
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

/**
 * Provides group acquisition of {@link java.util.concurrent.locks.Lock locks}: acquiring a set of
 * locks such that a thread holds all of them or none, and wrapping a function so that it always
 * runs under such a set.
 */
package com.ibm.synctools.locks;
