package agentauth;

import io.restassured.common.mapper.TypeRef;

import java.util.Map;

public interface TestUtils {

    TypeRef<Map<String, Object>> mapTypeRef = new TypeRef<Map<String, Object>>() {
    };

}
