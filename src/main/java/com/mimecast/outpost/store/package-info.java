/**
 * Queue storage.
 */
package com.mimecast.outpost.store;
