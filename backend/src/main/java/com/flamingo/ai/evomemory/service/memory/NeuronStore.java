package com.flamingo.ai.evomemory.service.memory;

import com.flamingo.ai.evomemory.domain.entity.Neuron;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Durable storage of neurons, the single source of truth of the episodic memory. Every operation
 * is atomic on its own; there are no transactions spanning several calls.
 */
public interface NeuronStore {

  /**
   * Persists a new neuron.
   *
   * @param neuron the neuron to store, without an id
   * @return the id assigned to the neuron
   * @throws com.flamingo.ai.evomemory.exception.NeuronValidationException if confidence,
   *     feedback or texts are invalid
   * @throws com.flamingo.ai.evomemory.exception.StorageException if the database fails
   */
  long save(Neuron neuron);

  /**
   * Gets a neuron by id.
   *
   * @param id the neuron id
   * @return the neuron, or empty when absent
   */
  Optional<Neuron> get(long id);

  /** Gets the most recent neurons, newest first. */
  List<Neuron> recent(int limit);

  /**
   * Gets the most recent neurons, newest first, optionally restricted to one skill.
   *
   * @param limit maximum number of neurons
   * @param skillId skill filter, null for all skills
   * @return neurons ordered by timestamp descending
   */
  List<Neuron> recent(int limit, String skillId);

  /**
   * Gets neurons with the given context hash, most confident first, then newest.
   *
   * @param contextHash the hash computed by {@link ContextHasher}
   * @param limit maximum number of neurons
   * @return matching neurons
   */
  List<Neuron> similar(String contextHash, int limit);

  /**
   * Case-insensitive substring filter over input and output text, most confident first, then
   * newest. The text is matched literally and case folding covers accented letters. Not a ranked
   * search.
   */
  List<Neuron> search(String text, int limit);

  /**
   * Records user feedback and recomputes the mood.
   *
   * @param id the neuron id
   * @param feedback -1, 0 or 1
   * @return false when no neuron has this id
   */
  boolean updateFeedback(long id, int feedback);

  /**
   * Deletes neurons older than {@code keepDays} with confidence below {@code minConfidence} and no
   * positive feedback.
   *
   * @return number of deleted neurons
   */
  int prune(int keepDays, double minConfidence);

  /** Prunes with the configured retention policy. */
  int prune();

  /** Increments the access count and refreshes the last access time of the given neurons. */
  void recordAccess(Collection<Long> ids);

  /** Total number of stored neurons. */
  long count();
}
