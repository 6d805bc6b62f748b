package io.cmdtree.core.dispatch;

import java.util.Objects;

/** The callback an action runs, and whether it expects a user object. */
public final class ActionBinding {
  private final ActionCallback plain;
  private final UserActionCallback<Object> withUser;
  private final Class<?> userType;

  private ActionBinding(
      ActionCallback plain, UserActionCallback<Object> withUser, Class<?> userType) {
    this.plain = plain;
    this.withUser = withUser;
    this.userType = userType;
  }

  public static ActionBinding of(ActionCallback callback) {
    return new ActionBinding(Objects.requireNonNull(callback, "callback"), null, null);
  }

  @SuppressWarnings("unchecked")
  public static <U> ActionBinding withUserObject(Class<U> userType, UserActionCallback<U> callback) {
    Objects.requireNonNull(userType, "userType");
    Objects.requireNonNull(callback, "callback");
    return new ActionBinding(null, (UserActionCallback<Object>) callback, userType);
  }

  public boolean needsUserObject() {
    return withUser != null;
  }

  /** Type the user object must have; {@code null} for plain callbacks. */
  public Class<?> userType() {
    return userType;
  }

  /**
   * Runs the callback.
   *
   * @throws IllegalStateException if a user object is required but missing or of the wrong type
   */
  public Object invoke(Object userObject, Arguments args) throws Exception {
    if (withUser == null) {
      return plain.invoke(args);
    }
    if (userObject == null) {
      throw new IllegalStateException(
          "Action requires a user object of type " + userType.getName() + " but none was given");
    }
    if (!userType.isInstance(userObject)) {
      throw new IllegalStateException(
          "Action requires a user object of type "
              + userType.getName()
              + ", got "
              + userObject.getClass().getName());
    }
    return withUser.invoke(userObject, args);
  }
}
