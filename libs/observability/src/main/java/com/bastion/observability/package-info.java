/**
 * Request correlation, MDC bridging, log redaction and metric helpers shared by Bastion services.
 */
package com.bastion.observability;
