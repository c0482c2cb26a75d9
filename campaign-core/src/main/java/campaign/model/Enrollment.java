package campaign.model;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Request to enroll one contact into a campaign plan version.
 *
 * <p>Create instances via {@link #builder(String, String)}.
 */
public final class Enrollment {
  private final String tenantId;
  private final String contactId;
  private final Map<Channel, String> addresses;
  private final Map<String, String> variables;
  private final String senderIdentityId;
  private final ZoneId timezone;

  private Enrollment(Builder builder) {
    this.tenantId = builder.tenantId;
    this.contactId = builder.contactId;
    this.addresses = Map.copyOf(builder.addresses);
    this.variables = Map.copyOf(builder.variables);
    this.senderIdentityId = builder.senderIdentityId;
    this.timezone = builder.timezone == null ? ZoneOffset.UTC : builder.timezone;
  }

  public static Builder builder(String tenantId, String contactId) {
    return new Builder(tenantId, contactId);
  }

  public String tenantId() {
    return tenantId;
  }

  public String contactId() {
    return contactId;
  }

  public Map<Channel, String> addresses() {
    return addresses;
  }

  public Map<String, String> variables() {
    return variables;
  }

  public String senderIdentityId() {
    return senderIdentityId;
  }

  public ZoneId timezone() {
    return timezone;
  }

  public static final class Builder {
    private final String tenantId;
    private final String contactId;
    private final Map<Channel, String> addresses = new EnumMap<>(Channel.class);
    private final Map<String, String> variables = new LinkedHashMap<>();
    private String senderIdentityId;
    private ZoneId timezone;

    private Builder(String tenantId, String contactId) {
      this.tenantId = tenantId;
      this.contactId = contactId;
    }

    /**
     * Sets the contact's destination on a channel (e-mail address, phone number).
     *
     * @param channel the channel
     * @param address the destination
     * @return this builder
     */
    public Builder address(Channel channel, String address) {
      addresses.put(Objects.requireNonNull(channel, "channel"), Objects.requireNonNull(address, "address"));
      return this;
    }

    /**
     * Adds a template variable used to render {@code {{name}}} placeholders.
     *
     * @param name  variable name
     * @param value variable value
     * @return this builder
     */
    public Builder variable(String name, String value) {
      variables.put(Objects.requireNonNull(name, "name"), value == null ? "" : value);
      return this;
    }

    public Builder variables(Map<String, String> values) {
      if (values != null) {
        values.forEach(this::variable);
      }
      return this;
    }

    /**
     * Sets the sender identity used for identity-scoped rate limits and provider sends.
     *
     * <p>Optional.
     */
    public Builder senderIdentityId(String senderIdentityId) {
      this.senderIdentityId = senderIdentityId;
      return this;
    }

    /**
     * Sets the contact's timezone used to honor step send windows.
     *
     * <p>Optional. Defaults to UTC.
     */
    public Builder timezone(ZoneId timezone) {
      this.timezone = timezone;
      return this;
    }

    public Enrollment build() {
      return new Enrollment(this);
    }
  }
}
