package com.promptsmith.optimizer.service.data;

import java.util.List;

import lombok.Value;

/** Ordered split of a record list: the first {@code trainSize} items train, the rest validate. */
@Value
public class DatasetPartition<T> {

  List<T> train;
  List<T> validation;

  public static <T> DatasetPartition<T> split(List<T> records, int trainSize) {
    if (trainSize < 0 || trainSize > records.size()) {
      throw new IllegalArgumentException(
          "trainSize " + trainSize + " outside 0.." + records.size());
    }
    return new DatasetPartition<>(
        List.copyOf(records.subList(0, trainSize)),
        List.copyOf(records.subList(trainSize, records.size())));
  }
}
