package sh.xana.hashdive.classify;

/** Result of classifying one message together with the state to use for the next one */
public record Classification(ClassifiedMessage message, ClassifierState state) {

  public MessageTag tag() {
    return message.tag();
  }
}
