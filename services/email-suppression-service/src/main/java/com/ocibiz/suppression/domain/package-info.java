/**
 * Suppression domain: the gateway port to the provider holding the suppression list and the
 * service that checks and removes entries. No Spring or OCI types appear here.
 */
package com.ocibiz.suppression.domain;
