/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: synctools
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

/**
 * Provides a bounded, blocking producer/consumer channel for exchanging values between threads.
 */
package com.ibm.synctools.channel;
