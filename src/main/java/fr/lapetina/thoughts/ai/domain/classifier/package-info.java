/**
 * Maps backend failures to an {@link fr.lapetina.thoughts.ai.domain.model.ErrorKind} and each
 * kind to the orchestrator's {@link fr.lapetina.thoughts.ai.domain.classifier.Recovery}.
 */
package fr.lapetina.thoughts.ai.domain.classifier;
