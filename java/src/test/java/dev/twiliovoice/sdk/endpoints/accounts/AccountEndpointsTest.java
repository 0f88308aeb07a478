package dev.twiliovoice.sdk.endpoints.accounts;

import dev.twiliovoice.sdk.endpoints.FormParam;
import dev.twiliovoice.sdk.internal.Json;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AccountEndpointsTest {

    @Test
    void suspendSendsOnlyStatus() {
        UpdateAccount endpoint = new UpdateAccount("AC9", AccountBody.withStatus(AccountStatus.SUSPENDED));

        assertEquals("/2010-04-01/Accounts/AC9.json", endpoint.path());
        assertEquals(List.of(new FormParam("Status", "suspended")), endpoint.body().params());
    }

    @Test
    void listFiltersByStatus() {
        ListAccounts endpoint = new ListAccounts(new AccountQuery().status(AccountStatus.ACTIVE).friendlyName("Main"));

        assertEquals(List.of(new FormParam("Status", "active"), new FormParam("FriendlyName", "Main")),
            endpoint.queryParams());
    }

    @Test
    void pageDecodesAccounts() throws Exception {
        String json = "{\"accounts\":[{\"sid\":\"AC1\",\"status\":\"closed\",\"type\":\"Trial\"}],"
            + "\"page\":0,\"page_size\":50,\"first_page_uri\":\"/2010-04-01/Accounts.json?Page=0\"}";

        AccountPage page = Json.mapper().readValue(json, AccountPage.class);

        assertEquals(1, page.accounts().size());
        assertEquals(AccountStatus.CLOSED, page.accounts().get(0).status());
        assertEquals(AccountType.TRIAL, page.accounts().get(0).type());
        assertFalse(page.pageInfo().hasNextPage());
    }
}
