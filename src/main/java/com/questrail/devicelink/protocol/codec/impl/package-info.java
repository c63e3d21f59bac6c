/**
 * Default implementation of the device frame codec.
 *
 * <p>{@link com.questrail.devicelink.protocol.codec.impl.FrameLayout} is the
 * single place that knows header offsets; encoder and decoder both go through
 * it.</p>
 */
package com.questrail.devicelink.protocol.codec.impl;
