package agentauth.model;

import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.ArrayList;
import java.util.Date;
import java.util.List;

@Getter
@NoArgsConstructor
@Document(collection = "registered_clients")
public class RegisteredClient implements Expirable {

    @Id
    private String clientId;
    //BCrypt hash, the plain secret is only returned at registration time
    private String secret;
    private String clientName;
    private List<String> redirectUris = new ArrayList<>();
    private List<String> grantTypes = new ArrayList<>();
    private List<String> responseTypes = new ArrayList<>();
    private String tokenEndpointAuthMethod;
    private String scope;
    private List<String> contacts;
    private String logoUri;
    private String clientUri;
    private String policyUri;
    private String tosUri;
    private long clientIdIssuedAt;

    @Transient
    private boolean staticClient;

    public RegisteredClient(String clientId, String secret, ClientMetadata metadata, long clientIdIssuedAt) {
        this.clientId = clientId;
        this.secret = secret;
        this.clientName = metadata.getClientName();
        this.redirectUris = metadata.getRedirectUris();
        this.grantTypes = metadata.getGrantTypes();
        this.responseTypes = metadata.getResponseTypes();
        this.tokenEndpointAuthMethod = metadata.getTokenEndpointAuthMethod();
        this.scope = metadata.getScope();
        this.contacts = metadata.getContacts();
        this.logoUri = metadata.getLogoUri();
        this.clientUri = metadata.getClientUri();
        this.policyUri = metadata.getPolicyUri();
        this.tosUri = metadata.getTosUri();
        this.clientIdIssuedAt = clientIdIssuedAt;
    }

    public static RegisteredClient staticClient(String clientId, List<String> redirectUris) {
        RegisteredClient client = new RegisteredClient();
        client.clientId = clientId;
        client.clientName = clientId;
        client.redirectUris = redirectUris != null ? redirectUris : new ArrayList<>();
        client.staticClient = true;
        return client;
    }

    @Override
    public String getId() {
        return clientId;
    }

    @Override
    public Date getExpiresIn() {
        return null;
    }
}
