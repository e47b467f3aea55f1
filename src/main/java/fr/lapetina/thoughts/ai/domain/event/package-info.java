/**
 * Ring buffer slot and task handle for queued analyses.
 */
package fr.lapetina.thoughts.ai.domain.event;
