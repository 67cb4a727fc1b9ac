/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: synctools
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

/**
 * Functional plumbing shared by the synchronization primitives: throwing function shapes and an
 * argument list which can be unpacked into standard functional interfaces.
 */
package com.ibm.synctools.util;
