package agentauth.log;

import agentauth.user.WorkspaceUser;
import org.junit.After;
import org.junit.Test;
import org.slf4j.MDC;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

public class MDCContextTest {

    @After
    public void after() {
        MDC.clear();
    }

    @Test
    public void mdcContext() {
        MDCContext.mdcContext(new WorkspaceUser("user", "workspace"), "action", "Token", "client_id", null);

        assertEquals("Token", MDC.get("action"));
        assertNull(MDC.get("client_id"));
        assertEquals("user", MDC.get("user_id"));
        assertEquals("workspace", MDC.get("workspace_id"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void oddNumberOfArguments() {
        MDCContext.mdcContext("action");
    }
}
