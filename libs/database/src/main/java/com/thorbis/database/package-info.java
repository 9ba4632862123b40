/** Persisted layout of the access platform: schema migrations and the configuration that runs them. */
package com.thorbis.database;
