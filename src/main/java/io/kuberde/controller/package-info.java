/**
 * Controller for {@code kuberde.io/v1beta1} {@code RDEAgent} resources.
 *
 * <p>{@link io.kuberde.controller.ControllerLoop} resyncs on a timer;
 * {@link io.kuberde.controller.Reconciler} owns deployments, relay routes and idle scale-down.
 */
package io.kuberde.controller;
