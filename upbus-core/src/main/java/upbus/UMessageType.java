package upbus;

/**
 * Kind of a {@link UMessage}.
 *
 * <p>The ordinal is part of the network wire format; append new constants only.
 */
public enum UMessageType {
  /** One-to-many, addressed by topic only. */
  PUBLISH,
  /** Point-to-point, carries the topic as source and an explicit destination. */
  NOTIFICATION
}
