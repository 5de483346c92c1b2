package tech.yump.passkeeper.secrets.account;

public record AccountSecret(
        String id,
        String login,
        String server,
        String password,
        String meta
) {
    @Override
    public String toString() {
        return "AccountSecret[id=" + id + ", login=" + login + ", server=" + server + ", password=******, meta=******]";
    }
}
