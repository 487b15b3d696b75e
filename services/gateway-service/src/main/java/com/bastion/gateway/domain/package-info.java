/**
 * Domain layer of the gateway: the per-request pipeline and the rules it enforces.
 *
 * <ul>
 *   <li>{@code policy/}: rule table and the first-match-wins engine
 *   <li>{@code forward/}: request/response values and the forwarding port
 *   <li>{@link com.bastion.gateway.domain.GatewayOrchestrator}: the per-request pipeline
 * </ul>
 *
 * <p>No Spring or servlet types here; adapters live in {@code infrastructure}.
 */
package com.bastion.gateway.domain;
